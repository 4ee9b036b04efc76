/*
 * どこで: Password expiry API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 起動確認を actuator なしでもできるようにするため
 */
package com.example.password_expiry.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "password-expiry: ok";
  }
}
