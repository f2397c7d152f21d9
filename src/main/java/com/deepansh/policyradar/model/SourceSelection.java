package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceSelection {

    private boolean auto;
    private boolean regulations;
    private boolean govinfo;
    private boolean congress;
    @JsonProperty("federal_register")
    private boolean federalRegister;
    private boolean usaspending;
    @JsonProperty("fiscal_data")
    private boolean fiscalData;
    private boolean datagov;
    private boolean doj;
    private boolean searchgov;

    /** Sources explicitly flagged by the caller, ignoring {@code auto}. */
    public Set<DataSource> flagged() {
        Set<DataSource> out = EnumSet.noneOf(DataSource.class);
        if (regulations) out.add(DataSource.REGULATIONS);
        if (govinfo) out.add(DataSource.GOVINFO);
        if (congress) out.add(DataSource.CONGRESS);
        if (federalRegister) out.add(DataSource.FEDERAL_REGISTER);
        if (usaspending) out.add(DataSource.USASPENDING);
        if (fiscalData) out.add(DataSource.FISCAL_DATA);
        if (datagov) out.add(DataSource.DATAGOV);
        if (doj) out.add(DataSource.DOJ);
        if (searchgov) out.add(DataSource.SEARCHGOV);
        return out;
    }
}
