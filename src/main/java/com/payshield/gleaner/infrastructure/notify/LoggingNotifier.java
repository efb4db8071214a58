package com.payshield.gleaner.infrastructure.notify;

import com.payshield.gleaner.domain.ports.NotifierPort;
import org.slf4j.Logger; import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

@Component
public class LoggingNotifier implements NotifierPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);
  @Override public void sendRunCompleted(UUID runId, Map<String, Object> summary) {
    Object total = summary.getOrDefault("total", 0);
    if (total instanceof Number n && n.longValue() > 0) {
      log.warn("Run {} produced {} gleans: {}", runId, total, summary.get("countsByType"));
    } else {
      log.info("Run {} produced no gleans", runId);
    }
  }
}
