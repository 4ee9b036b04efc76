/*
 * どこで: Password expiry API
 * 何を: 実行時設定の参照/更新と SMTP 接続確認
 * なぜ: 秘密情報をマスクしたまま運用画面から設定を変更できるようにするため
 */
package com.example.password_expiry.api;

import com.example.password_expiry.api.response.CheckResponse;
import com.example.password_expiry.model.AppSettings;
import com.example.password_expiry.service.MailConnectionService;
import com.example.password_expiry.service.SettingsStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SettingsController {

  private final SettingsStore settingsStore;
  private final MailConnectionService mailConnectionService;

  @GetMapping("/api/config")
  public AppSettings get() {
    return settingsStore.masked();
  }

  @RequestMapping(
      value = "/api/config",
      method = {RequestMethod.PUT, RequestMethod.POST})
  public AppSettings update(@RequestBody AppSettings update) {
    return settingsStore.update(update).masked();
  }

  @PostMapping("/api/test-smtp")
  public CheckResponse testSmtp() {
    mailConnectionService.verify();
    return new CheckResponse(true, "SMTP connection verified");
  }
}
