package com.nana.iep.service;

import com.nana.iep.domain.MasterTable;

import java.util.Objects;

/**
 * The new master table produced by a run, with its change summary.
 */
public final class ReconciliationResult {

    private final MasterTable   masterTable;
    private final ChangeSummary changeSummary;

    public ReconciliationResult(MasterTable masterTable, ChangeSummary changeSummary) {
        this.masterTable   = Objects.requireNonNull(masterTable, "masterTable");
        this.changeSummary = Objects.requireNonNull(changeSummary, "changeSummary");
    }

    public MasterTable getMasterTable()     { return masterTable; }

    public ChangeSummary getChangeSummary() { return changeSummary; }

    @Override
    public String toString() {
        return "ReconciliationResult{" + masterTable + ", " + changeSummary + "}";
    }
}
