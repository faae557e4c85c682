package com.civilworks.carbon.dto;

public class IngestDtos {

    /** Terminal state of an ingestion run. Only DONE means there is nothing left to resume. */
    public enum Outcome {
        DONE,
        ABORTED
    }

    /** Summary of one ingestion run, logged by the runner */
    public static class IngestReport {
        private Outcome outcome;
        private boolean resumed; // first request went to a persisted cursor
        private int pages_fetched;
        private int accepted; // records kept
        private int duplicates; // ocid already seen earlier in this run
        private int missing_id;
        private int rejected_unknown_cpv;
        private int rejected_cpv_prefix;
        private String failure; // reason when ABORTED
        private String output_path; // null when nothing was written

        public Outcome getOutcome() { return outcome; }
        public void setOutcome(Outcome outcome) { this.outcome = outcome; }
        public boolean isResumed() { return resumed; }
        public void setResumed(boolean resumed) { this.resumed = resumed; }
        public int getPages_fetched() { return pages_fetched; }
        public void setPages_fetched(int pages_fetched) { this.pages_fetched = pages_fetched; }
        public int getAccepted() { return accepted; }
        public void setAccepted(int accepted) { this.accepted = accepted; }
        public int getDuplicates() { return duplicates; }
        public void setDuplicates(int duplicates) { this.duplicates = duplicates; }
        public int getMissing_id() { return missing_id; }
        public void setMissing_id(int missing_id) { this.missing_id = missing_id; }
        public int getRejected_unknown_cpv() { return rejected_unknown_cpv; }
        public void setRejected_unknown_cpv(int rejected_unknown_cpv) { this.rejected_unknown_cpv = rejected_unknown_cpv; }
        public int getRejected_cpv_prefix() { return rejected_cpv_prefix; }
        public void setRejected_cpv_prefix(int rejected_cpv_prefix) { this.rejected_cpv_prefix = rejected_cpv_prefix; }
        public String getFailure() { return failure; }
        public void setFailure(String failure) { this.failure = failure; }
        public String getOutput_path() { return output_path; }
        public void setOutput_path(String output_path) { this.output_path = output_path; }
    }
}
