package com.codematch.core.target;

import com.codematch.core.config.CodematchProperties;
import com.codematch.core.error.InvalidRequestException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates and normalises verification targets supplied by callers.
 * Addresses are returned in lowercase {@code 0x}-prefixed form.
 */
@Component
public class TargetValidator {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern CHAIN_ID = Pattern.compile("^[1-9][0-9]{0,18}$");
    private static final Pattern SALT = Pattern.compile("^0x[0-9a-fA-F]{1,64}$");

    private final CodematchProperties properties;

    public TargetValidator(CodematchProperties properties) {
        this.properties = properties;
    }

    public String normalizeAddress(String address) {
        String normalized = tryNormalizeAddress(address);
        if (normalized == null) {
            throw new InvalidRequestException("Invalid address: " + address);
        }
        return normalized;
    }

    public List<String> normalizeAddresses(List<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            throw new InvalidRequestException("At least one address is required");
        }
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String address : addresses) {
            String normalized = tryNormalizeAddress(address);
            if (normalized == null) {
                invalid.add(address);
            } else {
                valid.add(normalized);
            }
        }
        if (!invalid.isEmpty()) {
            throw new InvalidRequestException("Invalid addresses: " + String.join(", ", invalid));
        }
        return valid;
    }

    public String normalizeChainId(String chainId) {
        String normalized = tryNormalizeChainId(chainId);
        if (normalized == null) {
            throw new InvalidRequestException("Invalid chainId: " + chainId);
        }
        return normalized;
    }

    public List<String> normalizeChainIds(List<String> chainIds) {
        if (chainIds == null || chainIds.isEmpty()) {
            throw new InvalidRequestException("At least one chainId is required");
        }
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String chainId : chainIds) {
            String normalized = tryNormalizeChainId(chainId);
            if (normalized == null) {
                invalid.add(chainId);
            } else {
                valid.add(normalized);
            }
        }
        if (!invalid.isEmpty()) {
            throw new InvalidRequestException("Invalid chainIds: " + String.join(", ", invalid));
        }
        return valid;
    }

    /**
     * A CREATE2 salt: {@code 0x} followed by at most 32 bytes of hex, lowercased.
     */
    public String normalizeSalt(String salt) {
        String trimmed = salt != null ? salt.trim() : "";
        if (!SALT.matcher(trimmed).matches()) {
            throw new InvalidRequestException("Invalid salt: " + salt);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private String tryNormalizeAddress(String address) {
        if (address == null) {
            return null;
        }
        String trimmed = address.trim();
        if (!ADDRESS.matcher(trimmed).matches()) {
            return null;
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    private String tryNormalizeChainId(String chainId) {
        if (chainId == null) {
            return null;
        }
        String trimmed = chainId.trim();
        if (!CHAIN_ID.matcher(trimmed).matches()) {
            return null;
        }
        List<String> supported = properties.getSupportedChains();
        if (supported != null && !supported.isEmpty() && !supported.contains(trimmed)) {
            return null;
        }
        return trimmed;
    }
}
