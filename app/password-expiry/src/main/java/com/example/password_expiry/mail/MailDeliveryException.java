/*
 * どこで: Password expiry メール送信
 * 何を: SMTP 送信/接続失敗を表す例外
 * なぜ: Jakarta Mail と Spring Mail の例外を呼び出し側で一つに扱うため
 */
package com.example.password_expiry.mail;

public class MailDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MailDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
