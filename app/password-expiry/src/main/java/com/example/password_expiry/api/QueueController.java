package com.example.password_expiry.api;

import com.example.password_expiry.model.QueueItem;
import com.example.password_expiry.service.DeliveryQueue;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/queue")
@RequiredArgsConstructor
public class QueueController {

  private final DeliveryQueue deliveryQueue;

  @GetMapping
  public List<QueueItem> list() {
    return deliveryQueue.list();
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> cancel(@PathVariable("id") String id) {
    if (!deliveryQueue.remove(id)) {
      throw new QueueItemNotFoundException(id);
    }
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/clear")
  public ResponseEntity<Void> clear() {
    deliveryQueue.clear();
    return ResponseEntity.noContent().build();
  }
}
