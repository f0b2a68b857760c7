package com.jsdesugar.jackson;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.jsdesugar.rewrite.RewriteOptions;

/**
 * The JSON shape of {@link RewriteOptions}. A bad prefix is rejected by the options
 * record itself, after Jackson is done, so it surfaces as IllegalArgumentException.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record OptionsDocument(
    @JsonProperty("namePrefix") @JsonAlias("customPrefix") String namePrefix
) {
    RewriteOptions toOptions() {
        return new RewriteOptions(namePrefix);
    }
}
