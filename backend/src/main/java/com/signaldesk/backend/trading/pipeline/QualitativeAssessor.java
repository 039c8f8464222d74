package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.QualitativeAssessment;
import com.signaldesk.backend.model.TechnicalSignal;

/**
 * Second opinion on a technical signal, typically backed by a slow network service.
 * Implementations may throw; callers treat any failure as "no signal this cycle".
 */
public interface QualitativeAssessor {
    QualitativeAssessment assess(String symbol, TechnicalSignal technicalSignal, MarketContext context);
}
