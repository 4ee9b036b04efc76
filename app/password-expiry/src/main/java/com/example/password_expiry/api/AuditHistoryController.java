package com.example.password_expiry.api;

import com.example.password_expiry.model.AuditEntry;
import com.example.password_expiry.service.AuditLedger;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuditHistoryController {

  private final AuditLedger auditLedger;

  @GetMapping("/api/history")
  public List<AuditEntry> history() {
    return auditLedger.history();
  }
}
