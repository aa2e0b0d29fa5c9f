package com.moreremesas.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Vendor code tables used in order fields and responses.
 */
public final class Catalogs {

    /** {@code OrderStatus} codes. */
    public static final Map<String, String> ORDER_STATUS;
    /** {@code BankAccType} codes. */
    public static final Map<String, String> BANK_ACCOUNT_TYPE;
    /** {@code Relationship} codes between customer and beneficiary. */
    public static final Map<Integer, String> RELATIONSHIP;
    /** {@code PourposeCode} codes. */
    public static final Map<Integer, String> PURPOSE;
    /** {@code Document/DocumentType} codes. */
    public static final Map<Integer, String> DOCUMENT_TYPE;
    /** Per payout country, the {@code BankInfo} fields with a country specific meaning. */
    public static final Map<String, Map<String, String>> BANK_ATTRIBUTES_BY_COUNTRY;

    static {
        Map<String, String> status = new LinkedHashMap<>();
        status.put("P", "Pending");
        status.put("F", "Paid");
        status.put("R", "Withheld");
        status.put("A", "Canceled");
        status.put("I", "Incidence");
        status.put("N", "Pending Activation");
        status.put("T", "In transit");
        ORDER_STATUS = Collections.unmodifiableMap(status);

        Map<String, String> accounts = new LinkedHashMap<>();
        accounts.put("AHO", "Savings Account");
        accounts.put("CTE", "Checking Account");
        BANK_ACCOUNT_TYPE = Collections.unmodifiableMap(accounts);

        Map<Integer, String> relationship = new LinkedHashMap<>();
        String[] relations = {
            "Spouse", "Son/Daughter", "Parents", "Siblings", "Close Relative", "Him/Herself", "Ex-Spouse", "Friend",
            "Business Partner", "Client", "Employee", "Supplier", "Creditor", "Debtor", "Franchisee", "Non related"
        };
        for (int i = 0; i < relations.length; i++) {
            relationship.put(i + 1, relations[i]);
        }
        relationship.put(9999, "No information");
        RELATIONSHIP = Collections.unmodifiableMap(relationship);

        Map<Integer, String> purpose = new LinkedHashMap<>();
        String[] purposes = {
            "Other", "Family Aid", "Gift", "Service Payment", "Goods purchase", "Medicine Purchase", "Study Payments",
            "Debt Payment", "Fees and services", "Travel Ticket", "Alimony"
        };
        for (int i = 0; i < purposes.length; i++) {
            purpose.put(i + 1, purposes[i]);
        }
        PURPOSE = Collections.unmodifiableMap(purpose);

        Map<Integer, String> documents = new LinkedHashMap<>();
        documents.put(1, "Cédula de Identidad Uruguaya");
        documents.put(98, "CPF");
        documents.put(99, "Documento de Identidad Extranjero");
        documents.put(523, "Pasaporte");
        documents.put(541, "DNI - Argentina");
        documents.put(561, "Cédula de Identidad Chilena");
        documents.put(575, "Carné Identidad Cubano");
        documents.put(5911, "Cédula Identidad Boliviana");
        documents.put(5951, "Cédula Identidad Paraguaya");
        DOCUMENT_TYPE = Collections.unmodifiableMap(documents);

        Map<String, Map<String, String>> bank = new LinkedHashMap<>();
        bank.put("US", Map.of("BankBranch", "ABA Routing number (9 digits)"));
        bank.put("ES", Map.of("BankAccount", "IBAN (ES + 22 digits)"));
        bank.put("AR", Map.of("BankDocument", "CUIT/CUIL", "BankAccount", "CBU (22 digits)"));
        bank.put("CL", Map.of("BankDocument", "RUN/RUT"));
        bank.put("BR", Map.of("BankDocument", "CPF (11 digits)"));
        BANK_ATTRIBUTES_BY_COUNTRY = Collections.unmodifiableMap(bank);
    }

    private Catalogs() {
    }

    public static Optional<String> orderStatus(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(ORDER_STATUS.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    public static Optional<String> bankAccountType(String code) {
        return code == null ? Optional.empty() : Optional.ofNullable(BANK_ACCOUNT_TYPE.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    public static Optional<String> relationship(String code) {
        return lookup(RELATIONSHIP, code);
    }

    public static Optional<String> purpose(String code) {
        return lookup(PURPOSE, code);
    }

    public static Optional<String> documentType(String code) {
        return lookup(DOCUMENT_TYPE, code);
    }

    /**
     * @return the country specific {@code BankInfo} fields for an ISO 3166-1 alpha-2 code; empty when none apply.
     */
    public static Map<String, String> bankAttributes(String country) {
        if (country == null) {
            return Map.of();
        }
        return BANK_ATTRIBUTES_BY_COUNTRY.getOrDefault(country.trim().toUpperCase(Locale.ROOT), Map.of());
    }

    private static Optional<String> lookup(Map<Integer, String> table, String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(table.get(Integer.parseInt(code.trim())));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
