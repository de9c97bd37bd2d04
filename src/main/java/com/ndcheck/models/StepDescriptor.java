package com.ndcheck.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One proof step as sent by the editor: {@code kind}, {@code indent} and the line text
 * {@code "<formula>; <justification>"}. Older clients send the formula and
 * justification separately instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepDescriptor {

    private String kind;
    private Integer indent;
    @JsonAlias("raw")
    private String rawText;
    private Integer lineNumber;
    private String formulaText;
    private String justText;

    public StepDescriptor() {
    }

    public StepDescriptor(String kind, Integer indent, String rawText) {
        this.kind = kind;
        this.indent = indent;
        this.rawText = rawText;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public Integer getIndent() {
        return indent;
    }

    public void setIndent(Integer indent) {
        this.indent = indent;
    }

    public String getRawText() {
        return rawText;
    }

    public void setRawText(String rawText) {
        this.rawText = rawText;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    public void setLineNumber(Integer lineNumber) {
        this.lineNumber = lineNumber;
    }

    public String getFormulaText() {
        return formulaText;
    }

    public void setFormulaText(String formulaText) {
        this.formulaText = formulaText;
    }

    public String getJustText() {
        return justText;
    }

    public void setJustText(String justText) {
        this.justText = justText;
    }

    /**
     * The line text, rebuilt from the separate fields when no raw text was sent.
     */
    public String resolveText() {
        if (rawText != null && !rawText.isBlank()) {
            return rawText;
        }
        String formula = formulaText != null ? formulaText.trim() : "";
        if (justText == null || justText.isBlank()) {
            return formula;
        }
        return formula + "; " + justText.trim();
    }
}
