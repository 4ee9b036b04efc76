package com.example.password_expiry.mail;

import java.util.List;

/** A fully rendered message ready for the SMTP transport. */
public record OutgoingMail(
    String from,
    String to,
    List<String> cc,
    String subject,
    String body,
    boolean readReceiptRequested) {

  public OutgoingMail {
    cc = cc == null ? List.of() : List.copyOf(cc);
  }
}
