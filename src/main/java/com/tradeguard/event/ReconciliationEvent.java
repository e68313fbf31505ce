package com.tradeguard.event;

import com.tradeguard.domain.model.ReconciliationReport;
import org.springframework.context.ApplicationEvent;

/** Published after every reconciliation run, scheduled or requested over the API. */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationReport report;
    private final boolean manual;

    /**
     * @param manual true if triggered via API, false if scheduled
     */
    public ReconciliationEvent(Object source, ReconciliationReport report, boolean manual) {
        super(source);
        this.report = report;
        this.manual = manual;
    }

    public ReconciliationReport getReport() {
        return report;
    }

    public boolean isManual() {
        return manual;
    }
}
