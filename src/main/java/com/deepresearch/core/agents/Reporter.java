package com.deepresearch.core.agents;

import com.deepresearch.core.model.Plan;
import com.deepresearch.core.model.Observation;
import com.deepresearch.core.model.ReportStyle;
import com.deepresearch.core.model.Resource;

import java.util.List;

/**
 * Renders the final report. Must be deterministic: identical inputs give identical output.
 */
public interface Reporter {

    /**
     * @param query        the clarified query
     * @param plan         the last plan, may be null when planning never produced one
     * @param observations every observation in store order
     * @param resources    deduplicated sources in discovery order
     * @param style        report style
     * @param locale       research locale
     */
    String report(String query, Plan plan, List<Observation> observations, List<Resource> resources,
                  ReportStyle style, String locale);
}
