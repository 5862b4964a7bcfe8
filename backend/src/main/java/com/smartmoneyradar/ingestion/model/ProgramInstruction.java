package com.smartmoneyradar.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Top-level or inner instruction; only the program id is used (DEX whitelist scan).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgramInstruction(
        String programId,
        List<ProgramInstruction> innerInstructions
) {

    public ProgramInstruction {
        innerInstructions = innerInstructions == null ? List.of() : innerInstructions;
    }
}
