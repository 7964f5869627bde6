package com.mlld.sdk.types.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Static analysis of an mlld module.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzeResult {
    private String filepath;
    private boolean valid = true;
    private List<AnalysisError> errors = new ArrayList<>();
    private List<Executable> executables = new ArrayList<>();
    private List<String> exports = new ArrayList<>();
    private List<Import> imports = new ArrayList<>();
    private List<Guard> guards = new ArrayList<>();
    private Needs needs;
}
