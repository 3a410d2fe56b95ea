package com.costsentinel.core.context;

import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.CustomEvent;
import com.costsentinel.core.model.ProbableCause;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches caller-declared events (deployments, migrations, launches) to an
 * anomaly. An event within one day that applies to the service is a
 * {@code very high} confidence cause.
 *
 * @since 1.0.0
 */
public class CustomEventMatcher {

    static final int WINDOW_DAYS = 1;

    public List<ProbableCause> match(LocalDate date, String service, List<CustomEvent> events) {
        List<ProbableCause> causes = new ArrayList<>();
        if (date == null || events == null) {
            return causes;
        }
        for (CustomEvent event : events) {
            if (Math.abs(event.getDate().toEpochDay() - date.toEpochDay()) > WINDOW_DAYS
                    || !event.appliesTo(service)) {
                continue;
            }
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("date", event.getDate().toString());
            info.put("services", event.getServices());
            info.put("description", event.getDescription());
            info.putAll(event.getAttributes());
            causes.add(new ProbableCause(event.getName(), CauseConfidence.VERY_HIGH,
                    event.getDescription(), ProbableCause.Source.CUSTOM_EVENT, info));
        }
        return causes;
    }
}
