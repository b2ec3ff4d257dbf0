package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.RiskLimits;
import com.tradecycle.backend.trading.model.RiskVerdict;

import java.util.List;

public interface RiskGate {

    /**
     * One verdict per decision item, in input order. Risk violations are verdicts, never exceptions.
     */
    List<RiskVerdict> evaluate(Decision decision, MarketSnapshot snapshot, RiskLimits limits);
}
