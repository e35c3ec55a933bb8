package com.walletpnl.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number and address formatting for log reports.
 */
public final class ReportFormat {

    static final String UNKNOWN = "n/a";

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private ReportFormat() {
    }

    /**
     * Two decimals, with K/M suffixes from one thousand / one million up. Null prints as n/a.
     */
    public static String number(BigDecimal value) {
        if (value == null) {
            return UNKNOWN;
        }
        BigDecimal abs = value.abs();
        if (abs.compareTo(MILLION) >= 0) {
            return value.divide(MILLION, 2, RoundingMode.HALF_UP).toPlainString() + "M";
        }
        if (abs.compareTo(THOUSAND) >= 0) {
            return value.divide(THOUSAND, 2, RoundingMode.HALF_UP).toPlainString() + "K";
        }
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public static String usd(BigDecimal value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value.signum() < 0 ? "-$" + number(value.negate()) : "$" + number(value);
    }

    public static String signedUsd(BigDecimal value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value.signum() > 0 ? "+" + usd(value) : usd(value);
    }

    public static String percent(BigDecimal value) {
        if (value == null) {
            return UNKNOWN;
        }
        String formatted = value.setScale(2, RoundingMode.HALF_UP).toPlainString() + "%";
        return value.signum() > 0 ? "+" + formatted : formatted;
    }

    /**
     * First and last {@code chars} characters of an address joined by "...".
     */
    public static String shortAddress(String address, int chars) {
        if (address == null || address.length() <= chars * 2) {
            return address;
        }
        return address.substring(0, chars) + "..." + address.substring(address.length() - chars);
    }
}
