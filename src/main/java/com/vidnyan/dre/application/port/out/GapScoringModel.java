package com.vidnyan.dre.application.port.out;

import com.vidnyan.dre.domain.gap.InformationGap;
import com.vidnyan.dre.domain.gap.Severity;

import java.util.Map;

/**
 * Pluggable scoring that may assign a gap a severity other than its rule default.
 */
public interface GapScoringModel {

    /**
     * @return the severity to use, which may be the gap's current one
     */
    Severity score(InformationGap gap, Map<String, Object> taskContext);
}
