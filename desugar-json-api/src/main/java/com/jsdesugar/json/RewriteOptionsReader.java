package com.jsdesugar.json;

import com.jsdesugar.rewrite.RewriteOptions;

import java.nio.file.Path;

/**
 * Reads {@link RewriteOptions} from a JSON document such as
 * <pre>{@code {"namePrefix": "__"}}</pre>
 * Keys that are not recognized are ignored; a missing prefix means the default.
 */
public interface RewriteOptionsReader {

    /**
     * @throws AstJsonException if the document is malformed
     * @throws IllegalArgumentException if the prefix cannot start an identifier
     */
    RewriteOptions read(String json) throws AstJsonException;

    /**
     * @throws AstJsonException if the file cannot be read or is malformed
     * @throws IllegalArgumentException if the prefix cannot start an identifier
     */
    RewriteOptions read(Path file) throws AstJsonException;
}
