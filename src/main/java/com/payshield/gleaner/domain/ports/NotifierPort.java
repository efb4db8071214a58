package com.payshield.gleaner.domain.ports;

import java.util.Map;
import java.util.UUID;

public interface NotifierPort {

    void sendRunCompleted(UUID runId, Map<String, Object> summary);
}
