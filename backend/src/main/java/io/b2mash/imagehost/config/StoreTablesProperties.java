package io.b2mash.imagehost.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration for per-store tables.
 *
 * @param declarativeCascade emit {@code ON DELETE CASCADE} on store foreign keys; the explicit
 *     cascade walk runs either way
 * @param transactionTimeout upper bound for any single store transaction
 * @param codeSuffixLimit how many numbered suffixes to try when deriving a free image code
 * @param searchFetchSize rows fetched per round trip while a search stream is consumed
 */
@ConfigurationProperties(prefix = "imagehost.store-tables")
public record StoreTablesProperties(
    @DefaultValue("true") boolean declarativeCascade,
    @DefaultValue("30s") Duration transactionTimeout,
    @DefaultValue("1000") int codeSuffixLimit,
    @DefaultValue("100") int searchFetchSize) {}
