package com.tradeguard.reconciliation;

import com.tradeguard.domain.model.ExternalTrade;
import java.time.Instant;
import java.util.List;

/**
 * Venue-side trade history used as ground truth by the scheduled reconciliation pass.
 * Optional; without one, reconciliation only runs when trades are posted to the API.
 */
public interface ExternalTradeSource {

    List<ExternalTrade> tradesSince(Instant since);
}
