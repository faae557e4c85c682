package com.civilworks.carbon.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * A screened contract: the input {@link ContractRecord} plus the screening outcome.
 *
 * <p>The fields present depend on {@link #getStatus()}:
 * <ul>
 *   <li>{@code CALCULATED} carries a {@link CarbonEstimate}</li>
 *   <li>{@code SKIPPED_INVALID_REF} carries the reference row's raw price and factor</li>
 *   <li>the other skip statuses carry nothing beyond the contract</li>
 * </ul>
 * Instances are immutable; use the static factories.
 */
public final class RiskRecord {
    public static final List<String> RISK_COLUMNS = List.of(
            "pqe_status", "ref_price", "ref_factor",
            "detected_material_id", "detected_material_name", "applied_price_rate", "applied_carbon_factor",
            "est_material_tonnes", "est_co2e_tonnes", "co2e_range_low", "co2e_range_high",
            "risk_category", "data_source_ref");

    /** Computed rows by CO2e descending, then every row without an estimate. */
    public static final Comparator<RiskRecord> BY_CO2E_DESC = Comparator.comparingDouble(
            (RiskRecord r) -> r.estimate == null ? Double.NEGATIVE_INFINITY : r.estimate.getEst_co2e_tonnes()).reversed();

    private final ContractRecord contract;
    private final PqeStatus status;
    private final CarbonEstimate estimate;
    private final String ref_price;
    private final String ref_factor;

    private RiskRecord(ContractRecord contract, PqeStatus status, CarbonEstimate estimate, String refPrice, String refFactor) {
        this.contract = contract;
        this.status = status;
        this.estimate = estimate;
        this.ref_price = refPrice;
        this.ref_factor = refFactor;
    }

    public static RiskRecord calculated(ContractRecord contract, CarbonEstimate estimate) {
        return new RiskRecord(contract, PqeStatus.CALCULATED, estimate, null, null);
    }

    public static RiskRecord lowValue(ContractRecord contract) {
        return new RiskRecord(contract, PqeStatus.SKIPPED_LOW_VALUE, null, null, null);
    }

    public static RiskRecord noReference(ContractRecord contract) {
        return new RiskRecord(contract, PqeStatus.SKIPPED_NO_REF, null, null, null);
    }

    public static RiskRecord invalidReference(ContractRecord contract, MaterialProfile material) {
        return new RiskRecord(contract, PqeStatus.SKIPPED_INVALID_REF, null,
                material.getRaw_price(), material.getRaw_carbon_factor());
    }

    public static List<String> columns() {
        List<String> cols = new ArrayList<>(ContractRecord.COLUMNS);
        cols.addAll(RISK_COLUMNS);
        return cols;
    }

    public Map<String, Object> toRow() {
        Map<String, Object> row = contract.toRow();
        row.put("pqe_status", status.name());
        row.put("ref_price", ref_price);
        row.put("ref_factor", ref_factor);
        if (estimate != null) {
            row.put("detected_material_id", estimate.getDetected_material_id());
            row.put("detected_material_name", estimate.getDetected_material_name());
            row.put("applied_price_rate", estimate.getApplied_price_rate());
            row.put("applied_carbon_factor", estimate.getApplied_carbon_factor());
            row.put("est_material_tonnes", estimate.getEst_material_tonnes());
            row.put("est_co2e_tonnes", estimate.getEst_co2e_tonnes());
            row.put("co2e_range_low", estimate.getCo2e_range_low());
            row.put("co2e_range_high", estimate.getCo2e_range_high());
            row.put("risk_category", estimate.getRisk_category().name());
            row.put("data_source_ref", estimate.getData_source_ref());
        }
        return row;
    }

    public ContractRecord getContract() { return contract; }
    public PqeStatus getStatus() { return status; }
    public CarbonEstimate getEstimate() { return estimate; }
    public String getRef_price() { return ref_price; }
    public String getRef_factor() { return ref_factor; }

    /** Derived figures of a {@code CALCULATED} row. Tonnages are rounded to two decimals. */
    public static final class CarbonEstimate {
        private final String detected_material_id;
        private final String detected_material_name;
        private final double applied_price_rate;
        private final double applied_carbon_factor;
        private final double est_material_tonnes;
        private final double est_co2e_tonnes;
        private final double co2e_range_low;
        private final double co2e_range_high;
        private final RiskCategory risk_category;
        private final String data_source_ref;

        public CarbonEstimate(String detectedMaterialId, String detectedMaterialName,
                              double appliedPriceRate, double appliedCarbonFactor,
                              double estMaterialTonnes, double estCo2eTonnes,
                              double co2eRangeLow, double co2eRangeHigh,
                              RiskCategory riskCategory, String dataSourceRef) {
            this.detected_material_id = detectedMaterialId;
            this.detected_material_name = detectedMaterialName;
            this.applied_price_rate = appliedPriceRate;
            this.applied_carbon_factor = appliedCarbonFactor;
            this.est_material_tonnes = estMaterialTonnes;
            this.est_co2e_tonnes = estCo2eTonnes;
            this.co2e_range_low = co2eRangeLow;
            this.co2e_range_high = co2eRangeHigh;
            this.risk_category = riskCategory;
            this.data_source_ref = dataSourceRef;
        }

        public String getDetected_material_id() { return detected_material_id; }
        public String getDetected_material_name() { return detected_material_name; }
        public double getApplied_price_rate() { return applied_price_rate; }
        public double getApplied_carbon_factor() { return applied_carbon_factor; }
        public double getEst_material_tonnes() { return est_material_tonnes; }
        public double getEst_co2e_tonnes() { return est_co2e_tonnes; }
        public double getCo2e_range_low() { return co2e_range_low; }
        public double getCo2e_range_high() { return co2e_range_high; }
        public RiskCategory getRisk_category() { return risk_category; }
        public String getData_source_ref() { return data_source_ref; }
    }
}
