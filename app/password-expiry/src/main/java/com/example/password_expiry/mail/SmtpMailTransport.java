/*
 * どこで: Password expiry メール送信
 * 何を: JavaMailSenderImpl で MIME メッセージを組み立てて送信する
 * なぜ: CC と開封確認ヘッダーを含むメールを 1 箇所で構築するため
 */
package com.example.password_expiry.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;

public class SmtpMailTransport implements MailTransport {

  static final String READ_RECEIPT_HEADER = "Disposition-Notification-To";

  private final JavaMailSenderImpl sender;

  public SmtpMailTransport(JavaMailSenderImpl sender) {
    this.sender = sender;
  }

  @Override
  public void send(OutgoingMail mail) {
    try {
      final MimeMessage message = sender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
      helper.setFrom(mail.from());
      helper.setTo(mail.to());
      if (!mail.cc().isEmpty()) {
        helper.setCc(mail.cc().toArray(String[]::new));
      }
      helper.setSubject(mail.subject());
      helper.setText(mail.body(), false);
      if (mail.readReceiptRequested()) {
        message.setHeader(READ_RECEIPT_HEADER, mail.from());
      }
      sender.send(message);
    } catch (MessagingException | MailException ex) {
      throw new MailDeliveryException("mail delivery failed to=" + mail.to(), ex);
    }
  }

  @Override
  public void verifyConnection() {
    try {
      sender.testConnection();
    } catch (MessagingException ex) {
      throw new MailDeliveryException(
          "smtp connection failed host=" + sender.getHost() + " port=" + sender.getPort(), ex);
    }
  }
}
