package com.fintech.bankrec.service.imports;

import com.fintech.bankrec.config.ResilienceConfig;
import com.fintech.bankrec.entity.VendorAlias;
import com.fintech.bankrec.exception.VendorLookupException;
import com.fintech.bankrec.repository.VendorAliasRepository;
import com.fintech.bankrec.service.matching.VendorSimilarity;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves raw vendor names through the externally maintained {@code vendor_aliases}
 * table.
 * <p>
 * Lookups are retried on transient failures; when the circuit is open the raw vendor
 * name is used as-is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VendorCanonicalizationClient {

    private final VendorAliasRepository aliasRepository;

    @CircuitBreaker(name = ResilienceConfig.VENDOR_LOOKUP, fallbackMethod = "canonicalizeFallback")
    @Retryable(
            retryFor = VendorLookupException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public Optional<String> canonicalize(String rawVendor) {
        String key = VendorSimilarity.vendorKey(rawVendor);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        try {
            return aliasRepository.findById(key).map(VendorAlias::getCanonicalName);
        } catch (DataAccessException e) {
            throw new VendorLookupException("Vendor alias lookup failed", rawVendor, e);
        }
    }

    public Optional<String> canonicalizeFallback(String rawVendor, Throwable throwable) {
        log.warn("Vendor lookup unavailable for '{}', keeping raw name. Error: {}",
                rawVendor, throwable.getMessage());
        return Optional.empty();
    }
}
