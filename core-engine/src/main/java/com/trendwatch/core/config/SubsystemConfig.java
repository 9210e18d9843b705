package com.trendwatch.core.config;

import com.trendwatch.core.trend.TrendDefinition;
import com.trendwatch.core.trend.TrendValidationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The trends configured for one subsystem.
 *
 * @since 1.0.0
 */
public class SubsystemConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String name;
    private List<TrendConfig> trends = new ArrayList<>();

    /**
     * @return validated definitions in configuration order
     * @throws TrendValidationException on the first invalid trend
     */
    public List<TrendDefinition> toDefinitions() throws TrendValidationException {
        List<TrendDefinition> definitions = new ArrayList<>(trends.size());
        for (TrendConfig trend : trends) {
            if (trend == null) {
                throw new TrendValidationException(TrendValidationException.Kind.WRONG_TYPE,
                        "Subsystem '" + name + "' has an empty trend entry");
            }
            definitions.add(trend.toDefinition());
        }
        return definitions;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * @return unmodifiable list of trend entries
     */
    public List<TrendConfig> getTrends() {
        return Collections.unmodifiableList(trends);
    }

    public void setTrends(List<TrendConfig> trends) {
        this.trends = trends != null ? new ArrayList<>(trends) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "SubsystemConfig{name='" + name + "', trends=" + trends + '}';
    }
}
