package com.smartmoneyradar.ingestion.filter;

import com.smartmoneyradar.ingestion.config.TrackedWalletProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable set of tracked wallets, fixed for the lifetime of the context. Invalid or duplicate entries are
 * dropped with a warning; no valid wallet at all is fatal.
 */
@Component
@Slf4j
public class TrackedWallets {

    private final List<String> ordered;
    private final Set<String> members;

    public TrackedWallets(TrackedWalletProperties properties, AddressValidator addressValidator) {
        Set<String> unique = new LinkedHashSet<>();
        for (String raw : properties.getAddresses()) {
            if (!addressValidator.isValidAddress(raw)) {
                log.warn("Ignoring invalid tracked wallet address: '{}'", raw);
                continue;
            }
            unique.add(raw.trim());
        }
        if (unique.isEmpty()) {
            throw new IllegalStateException("No valid tracked wallets configured (smartmoney.tracked-wallets.addresses)");
        }
        this.ordered = Collections.unmodifiableList(new ArrayList<>(unique));
        this.members = Collections.unmodifiableSet(unique);
        log.info("Tracking {} wallets", ordered.size());
    }

    public boolean contains(String address) {
        return address != null && members.contains(address);
    }

    /** Wallets in configuration order. */
    public List<String> asList() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }
}
