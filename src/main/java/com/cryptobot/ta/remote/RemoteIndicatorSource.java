package com.cryptobot.ta.remote;

import com.cryptobot.ta.error.IndicatorFetchException;
import org.json.JSONObject;

/**
 * Fetches one pre-computed indicator payload.
 */
public interface RemoteIndicatorSource {
    JSONObject fetch(IndicatorSpec spec, FetchTarget target) throws IndicatorFetchException;
}
