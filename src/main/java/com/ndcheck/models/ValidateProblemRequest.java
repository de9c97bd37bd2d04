package com.ndcheck.models;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidateProblemRequest {

    private String logic;
    @JsonAlias("premises")
    private String premisesText;
    @JsonAlias("conclusion")
    private String conclusionText;

    public String getLogic() {
        return logic;
    }

    public void setLogic(String logic) {
        this.logic = logic;
    }

    public String getPremisesText() {
        return premisesText;
    }

    public void setPremisesText(String premisesText) {
        this.premisesText = premisesText;
    }

    public String getConclusionText() {
        return conclusionText;
    }

    public void setConclusionText(String conclusionText) {
        this.conclusionText = conclusionText;
    }
}
