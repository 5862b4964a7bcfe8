package com.smartmoneyradar.ingestion.filter;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates Solana wallet addresses loaded from configuration.
 */
@Component
public class AddressValidator {

    /** Solana Base58: 32-44 chars, no 0/O/I/l. */
    private static final Pattern SOLANA_ADDRESS = Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{32,44}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return SOLANA_ADDRESS.matcher(address.trim()).matches();
    }
}
