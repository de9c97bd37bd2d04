package com.ndcheck.models;

import java.util.ArrayList;
import java.util.List;

public class LogicInfo {

    private String name;
    private boolean firstOrder;
    private boolean modal;
    private String worldDiscipline;
    private List<String> operators = new ArrayList<>();
    private List<String> rules = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isFirstOrder() {
        return firstOrder;
    }

    public void setFirstOrder(boolean firstOrder) {
        this.firstOrder = firstOrder;
    }

    public boolean isModal() {
        return modal;
    }

    public void setModal(boolean modal) {
        this.modal = modal;
    }

    public String getWorldDiscipline() {
        return worldDiscipline;
    }

    public void setWorldDiscipline(String worldDiscipline) {
        this.worldDiscipline = worldDiscipline;
    }

    public List<String> getOperators() {
        return operators;
    }

    public void setOperators(List<String> operators) {
        this.operators = operators;
    }

    public List<String> getRules() {
        return rules;
    }

    public void setRules(List<String> rules) {
        this.rules = rules;
    }
}
