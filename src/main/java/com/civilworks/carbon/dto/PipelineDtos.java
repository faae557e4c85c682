package com.civilworks.carbon.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public class PipelineDtos {

    /** Strict civil-works filter outcome */
    public static class FilterReport {
        private int input_rows;
        private int retained;
        private int dropped;
        private String output_path;

        public int getInput_rows() { return input_rows; }
        public void setInput_rows(int input_rows) { this.input_rows = input_rows; }
        public int getRetained() { return retained; }
        public void setRetained(int retained) { this.retained = retained; }
        public int getDropped() { return dropped; }
        public void setDropped(int dropped) { this.dropped = dropped; }
        public String getOutput_path() { return output_path; }
        public void setOutput_path(String output_path) { this.output_path = output_path; }
    }

    /** Cleaning stage outcome: buyer canonicalization plus amount/duplicate pruning */
    public static class CleaningReport {
        private int input_rows;
        private int output_rows;
        private int distinct_buyer_names;
        private int buyer_clusters;
        private int dropped_duplicates; // repeated ocid, first kept
        private int dropped_non_positive; // amount <= 0 after parsing
        private String output_path;
        private String buyer_map_path;

        public int getInput_rows() { return input_rows; }
        public void setInput_rows(int input_rows) { this.input_rows = input_rows; }
        public int getOutput_rows() { return output_rows; }
        public void setOutput_rows(int output_rows) { this.output_rows = output_rows; }
        public int getDistinct_buyer_names() { return distinct_buyer_names; }
        public void setDistinct_buyer_names(int distinct_buyer_names) { this.distinct_buyer_names = distinct_buyer_names; }
        public int getBuyer_clusters() { return buyer_clusters; }
        public void setBuyer_clusters(int buyer_clusters) { this.buyer_clusters = buyer_clusters; }
        public int getDropped_duplicates() { return dropped_duplicates; }
        public void setDropped_duplicates(int dropped_duplicates) { this.dropped_duplicates = dropped_duplicates; }
        public int getDropped_non_positive() { return dropped_non_positive; }
        public void setDropped_non_positive(int dropped_non_positive) { this.dropped_non_positive = dropped_non_positive; }
        public String getOutput_path() { return output_path; }
        public void setOutput_path(String output_path) { this.output_path = output_path; }
        public String getBuyer_map_path() { return buyer_map_path; }
        public void setBuyer_map_path(String buyer_map_path) { this.buyer_map_path = buyer_map_path; }
    }

    /** Screening outcome with counts per status */
    public static class ScreeningReport {
        private int contracts;
        private int materials;
        private Map<String, Integer> status_counts = new LinkedHashMap<>();
        private String output_path;

        public int getContracts() { return contracts; }
        public void setContracts(int contracts) { this.contracts = contracts; }
        public int getMaterials() { return materials; }
        public void setMaterials(int materials) { this.materials = materials; }
        public Map<String, Integer> getStatus_counts() { return status_counts; }
        public void setStatus_counts(Map<String, Integer> status_counts) { this.status_counts = status_counts; }
        public String getOutput_path() { return output_path; }
        public void setOutput_path(String output_path) { this.output_path = output_path; }
    }
}
