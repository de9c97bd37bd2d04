package com.ndcheck.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ndcheck.proof.LineResult;
import com.ndcheck.proof.ProofResult;
import com.ndcheck.proof.ProofStatus;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckProofResponse {

    private boolean ok;
    private String status;
    private boolean complete;
    private String message;
    private String errorKind;
    private String incompleteReason;
    private List<LineVerdict> perLineResult = new ArrayList<>();

    public static CheckProofResponse from(ProofResult result) {
        CheckProofResponse response = new CheckProofResponse();
        response.setOk(result.getStatus() != ProofStatus.ERROR);
        response.setStatus(result.getStatus().getWireName());
        response.setComplete(result.isComplete());
        response.setMessage(result.getMessage());
        response.setErrorKind(result.getErrorKind() != null ? result.getErrorKind().getLabel() : null);
        response.setIncompleteReason(result.getIncompleteReason());
        List<LineVerdict> verdicts = new ArrayList<>();
        for (LineResult line : result.getLineResults()) {
            verdicts.add(new LineVerdict(line.getLineNumber(), line.isOk(), line.getMessage(),
                line.getErrorKind() != null ? line.getErrorKind().getLabel() : null));
        }
        response.setPerLineResult(verdicts);
        return response;
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public boolean isComplete() {
        return complete;
    }

    public void setComplete(boolean complete) {
        this.complete = complete;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(String errorKind) {
        this.errorKind = errorKind;
    }

    public String getIncompleteReason() {
        return incompleteReason;
    }

    public void setIncompleteReason(String incompleteReason) {
        this.incompleteReason = incompleteReason;
    }

    public List<LineVerdict> getPerLineResult() {
        return perLineResult;
    }

    public void setPerLineResult(List<LineVerdict> perLineResult) {
        this.perLineResult = perLineResult != null ? perLineResult : new ArrayList<>();
    }
}
