/*
 * どこで: Password expiry メール送信
 * 何を: 実行時 SMTP 設定から JavaMailSenderImpl を組み立てる
 * なぜ: 運用者が画面から変えた設定を再起動なしで次の送信に反映するため
 */
package com.example.password_expiry.mail;

import com.example.password_expiry.config.MailTransportProperties;
import com.example.password_expiry.model.SmtpSettings;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SmtpMailTransportFactory implements MailTransportFactory {

  private final MailTransportProperties properties;

  @Override
  public MailTransport create(SmtpSettings settings) {
    return new SmtpMailTransport(buildSender(settings));
  }

  JavaMailSenderImpl buildSender(SmtpSettings settings) {
    final JavaMailSenderImpl sender = new JavaMailSenderImpl();
    sender.setHost(settings.host());
    sender.setPort(settings.port() == null ? SmtpSettings.DEFAULT_PORT : settings.port());
    sender.setDefaultEncoding(StandardCharsets.UTF_8.name());
    final boolean authenticated = settings.username() != null && !settings.username().isBlank();
    if (authenticated) {
      sender.setUsername(settings.username());
      sender.setPassword(settings.password());
    }
    final Properties mail = sender.getJavaMailProperties();
    mail.put("mail.smtp.auth", String.valueOf(authenticated));
    mail.put(
        "mail.smtp.connectiontimeout", String.valueOf(properties.connectionTimeout().toMillis()));
    mail.put("mail.smtp.timeout", String.valueOf(properties.timeout().toMillis()));
    mail.put("mail.smtp.writetimeout", String.valueOf(properties.timeout().toMillis()));
    if (Boolean.TRUE.equals(settings.secure())) {
      mail.put("mail.smtp.ssl.enable", "true");
    } else {
      // 平文接続でもサーバーが対応していれば STARTTLS に切り替える
      mail.put("mail.smtp.starttls.enable", "true");
    }
    return sender;
  }
}
