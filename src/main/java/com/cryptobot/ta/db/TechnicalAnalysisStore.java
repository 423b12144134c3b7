package com.cryptobot.ta.db;

import com.cryptobot.ta.error.PersistException;
import com.cryptobot.ta.model.TechnicalAnalysisRecord;

import java.util.List;

public interface TechnicalAnalysisStore {
    /**
     * @return true when a row was written
     */
    boolean insert(TechnicalAnalysisRecord record) throws PersistException;

    /**
     * Newest first. A null or blank symbol reads across all symbols.
     */
    List<TechnicalAnalysisRecord> latest(String symbol, int limit) throws PersistException;
}
