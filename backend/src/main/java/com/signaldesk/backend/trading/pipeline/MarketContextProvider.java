package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.model.MarketContext;

public interface MarketContextProvider {
    MarketContext currentContext();
}
