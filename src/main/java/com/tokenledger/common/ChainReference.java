package com.tokenledger.common;

import com.tokenledger.common.exception.InvalidAddressException;
import com.tokenledger.common.exception.InvalidReferenceException;

import java.util.regex.Pattern;

/**
 * Format checks for identifiers that live on the chain: transfer references and addresses.
 */
public final class ChainReference {

    private static final Pattern TRANSACTION_REFERENCE = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private ChainReference() {
    }

    public static boolean isValidTransactionReference(String reference) {
        return reference != null && TRANSACTION_REFERENCE.matcher(reference).matches();
    }

    public static boolean isValidAddress(String address) {
        return address != null && ADDRESS.matcher(address).matches();
    }

    public static void validateTransactionReference(String reference) {
        if (!isValidTransactionReference(reference)) {
            throw new InvalidReferenceException(reference);
        }
    }

    public static void validateAddress(String address) {
        if (!isValidAddress(address)) {
            throw new InvalidAddressException(address);
        }
    }

    /**
     * Addresses are compared case-insensitively (checksummed and lower-case forms are the same account).
     */
    public static boolean sameAddress(String left, String right) {
        return left != null && left.equalsIgnoreCase(right);
    }
}
