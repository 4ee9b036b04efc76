/*
 * どこで: Password expiry メール送信
 * 何を: SMTP 送信と接続確認の境界
 * なぜ: ジョブとワーカーを実 SMTP から切り離してテストできるようにするため
 */
package com.example.password_expiry.mail;

public interface MailTransport {

  /**
   * Sends one message.
   *
   * @throws MailDeliveryException when the server rejects the message or cannot be reached
   */
  void send(OutgoingMail mail);

  /**
   * Opens and closes a connection with the configured credentials.
   *
   * @throws MailDeliveryException when the handshake or authentication fails
   */
  void verifyConnection();
}
