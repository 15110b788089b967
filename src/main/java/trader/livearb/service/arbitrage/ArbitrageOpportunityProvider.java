package trader.livearb.service.arbitrage;

import trader.livearb.model.OpportunityRecord;

import java.util.List;

public interface ArbitrageOpportunityProvider {
    List<OpportunityRecord> getActiveOpportunities();
}
