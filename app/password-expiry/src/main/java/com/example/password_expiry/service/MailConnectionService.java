package com.example.password_expiry.service;

import com.example.password_expiry.mail.MailTransportFactory;
import com.example.password_expiry.model.SmtpSettings;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MailConnectionService {

  private static final Logger logger = LoggerFactory.getLogger(MailConnectionService.class);

  private final SettingsStore settingsStore;
  private final MailTransportFactory mailTransportFactory;

  /**
   * Verifies the stored SMTP settings by opening a connection.
   *
   * @throws IllegalStateException when no SMTP host is configured
   * @throws com.example.password_expiry.mail.MailDeliveryException when the check fails
   */
  public void verify() {
    final SmtpSettings smtp = settingsStore.load().smtp();
    if (!smtp.isConfigured()) {
      throw new IllegalStateException("SMTP host is not configured");
    }
    mailTransportFactory.create(smtp).verifyConnection();
    logger.info("smtp connection verified host={} port={}", smtp.host(), smtp.port());
  }
}
