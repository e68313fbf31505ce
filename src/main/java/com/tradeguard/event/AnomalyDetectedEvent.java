package com.tradeguard.event;

import com.tradeguard.domain.model.AnomalyEvent;
import org.springframework.context.ApplicationEvent;

/** Published for every anomaly after it has been audited and handed to the risk engine. */
public class AnomalyDetectedEvent extends ApplicationEvent {

    private final AnomalyEvent anomaly;

    public AnomalyDetectedEvent(Object source, AnomalyEvent anomaly) {
        super(source);
        this.anomaly = anomaly;
    }

    public AnomalyEvent getAnomaly() {
        return anomaly;
    }
}
