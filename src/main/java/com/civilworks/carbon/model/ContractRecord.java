package com.civilworks.carbon.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One procurement notice as stored in the contract tables.
 *
 * <p>The same shape flows through every stage: the ingestor creates it from an OCDS
 * release, the strict filter narrows the table, the cleaning stage rewrites
 * {@code buyer_name} to its canonical form (keeping the original in {@code buyer_name_raw})
 * and the risk engine reads it back to produce a {@link RiskRecord}.
 *
 * <p>{@code value_amount} stays textual. Hand-edited or re-exported tables carry values
 * such as {@code "£4,999.50"}, so callers parse it leniently where a number is needed.
 */
public class ContractRecord {
    /** Column order of the contract tables. */
    public static final List<String> COLUMNS = List.of(
            "ocid", "title", "description", "cpv_code", "value_amount", "currency",
            "published_date", "buyer_name", "buyer_name_raw", "buyer_country", "tender_status", "source");

    /** Open Contracting id, unique within a table */
    private String ocid;
    private String title;
    private String description;
    /** Digits-only CPV code */
    private String cpv_code;
    private String value_amount;
    private String currency;
    private String published_date;
    private String buyer_name;
    private String buyer_name_raw;
    private String buyer_country;
    private String tender_status;
    private String source;

    public static ContractRecord fromRow(Map<String, String> row) {
        ContractRecord r = new ContractRecord();
        r.ocid = emptyToNull(row.get("ocid"));
        r.title = emptyToNull(row.get("title"));
        r.description = emptyToNull(row.get("description"));
        r.cpv_code = emptyToNull(row.get("cpv_code"));
        r.value_amount = emptyToNull(row.get("value_amount"));
        r.currency = emptyToNull(row.get("currency"));
        r.published_date = emptyToNull(row.get("published_date"));
        r.buyer_name = emptyToNull(row.get("buyer_name"));
        r.buyer_name_raw = emptyToNull(row.get("buyer_name_raw"));
        r.buyer_country = emptyToNull(row.get("buyer_country"));
        r.tender_status = emptyToNull(row.get("tender_status"));
        r.source = emptyToNull(row.get("source"));
        return r;
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("ocid", ocid);
        row.put("title", title);
        row.put("description", description);
        row.put("cpv_code", cpv_code);
        row.put("value_amount", value_amount);
        row.put("currency", currency);
        row.put("published_date", published_date);
        row.put("buyer_name", buyer_name);
        row.put("buyer_name_raw", buyer_name_raw);
        row.put("buyer_country", buyer_country);
        row.put("tender_status", tender_status);
        row.put("source", source);
        return row;
    }

    /** Title and description joined by a space, the text the material matcher reads. */
    public String screeningText() {
        return (title == null ? "" : title) + " " + (description == null ? "" : description);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    public String getOcid() { return ocid; }
    public void setOcid(String ocid) { this.ocid = ocid; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getCpv_code() { return cpv_code; }
    public void setCpv_code(String cpv_code) { this.cpv_code = cpv_code; }
    public String getValue_amount() { return value_amount; }
    public void setValue_amount(String value_amount) { this.value_amount = value_amount; }
    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }
    public String getPublished_date() { return published_date; }
    public void setPublished_date(String published_date) { this.published_date = published_date; }
    public String getBuyer_name() { return buyer_name; }
    public void setBuyer_name(String buyer_name) { this.buyer_name = buyer_name; }
    public String getBuyer_name_raw() { return buyer_name_raw; }
    public void setBuyer_name_raw(String buyer_name_raw) { this.buyer_name_raw = buyer_name_raw; }
    public String getBuyer_country() { return buyer_country; }
    public void setBuyer_country(String buyer_country) { this.buyer_country = buyer_country; }
    public String getTender_status() { return tender_status; }
    public void setTender_status(String tender_status) { this.tender_status = tender_status; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
}
