package com.github.anirbanmu.classcal.source;

import com.github.anirbanmu.classcal.config.ConfigException;
import com.github.anirbanmu.classcal.config.SourceConfig;
import com.github.anirbanmu.classcal.source.huflit.HuflitAdapter;
import com.github.anirbanmu.classcal.source.huflit.HuflitPortal;
import com.github.anirbanmu.classcal.source.sgu.SguAdapter;
import com.github.anirbanmu.classcal.source.sgu.SguPortal;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

// adapter kinds known to this build; a new school is a new entry here plus its tables
public final class Sources {
    private static final Map<String, Function<SourceConfig, Source>> KINDS = Map.of(
        "huflit", c -> new Source(c.name(), new HuflitPortal(c.baseUrl()), new HuflitAdapter(c.tables())),
        "sgu", c -> new Source(c.name(), new SguPortal(c.baseUrl()), new SguAdapter(c.tables())));

    private Sources() {
    }

    public static Source create(SourceConfig config) {
        Function<SourceConfig, Source> factory = KINDS.get(config.kind());
        if (factory == null) {
            throw new ConfigException("Source '" + config.name() + "' has unknown kind '" + config.kind() + "'. Known kinds: " + kinds());
        }
        return factory.apply(config);
    }

    public static Set<String> kinds() {
        return new TreeSet<>(KINDS.keySet());
    }
}
