package com.example.password_expiry.mail;

import com.example.password_expiry.model.SmtpSettings;

/** Builds a transport from the SMTP settings in effect for one job run or worker tick. */
public interface MailTransportFactory {

  MailTransport create(SmtpSettings settings);
}
