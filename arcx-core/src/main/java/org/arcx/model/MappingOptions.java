package org.arcx.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MappingOptions {
    public static final MappingOptions DEFAULTS = MappingOptions.builder().build();

    /** The active value must not repeat across rows of the owner table. */
    @Builder.Default boolean uniqueAcrossColumns = false;
    String indexNamePrefix;
    String foreignKeyNamePrefix;
}
