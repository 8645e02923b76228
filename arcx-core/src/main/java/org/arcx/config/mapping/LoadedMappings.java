package org.arcx.config.mapping;

import org.arcx.model.PolymorphicMapping;
import org.arcx.model.ReferencedKeyCatalog;

import java.util.List;

public record LoadedMappings(List<PolymorphicMapping> mappings, ReferencedKeyCatalog catalog) {
    public LoadedMappings {
        mappings = List.copyOf(mappings);
    }
}
