package io.trielite.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trielite.core.merge.LoggingMergeListener;
import io.trielite.core.merge.MergeConfig;
import io.trielite.core.merge.MergeListener;
import io.trielite.core.merge.ValueConflictPolicy;
import io.trielite.exchange.dto.MergeConfigJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads {@link MergeConfig} from a JSON file. Missing fields keep their defaults.
 */
public final class MergeConfigLoader {

    private MergeConfigLoader() {
        // utility
    }

    public static MergeConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return fromJson(mapper.readValue(path.toFile(), MergeConfigJson.class));
        } catch (IOException e) {
            throw new ExchangeFormatException("Failed to load MergeConfig from " + path, e);
        }
    }

    public static MergeConfig fromJson(MergeConfigJson cfg) {
        MergeConfig config = MergeConfig.defaults();
        if (cfg == null) return config;

        if (cfg.valuePolicy != null) {
            try {
                config = config.withValuePolicy(ValueConflictPolicy.valueOf(cfg.valuePolicy.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown valuePolicy: " + cfg.valuePolicy, e);
            }
        }
        if (cfg.logConflicts != null) {
            config = config.withListener(cfg.logConflicts ? new LoggingMergeListener() : MergeListener.NONE);
        }
        return config;
    }
}
