package com.ndcheck.controllers;

import com.ndcheck.ProofService;
import io.javalin.Javalin;
import io.javalin.http.Context;

public class LogicController implements Controller {

    private final ProofService proofService;

    public LogicController(ProofService proofService) {
        this.proofService = proofService;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/logics", this::listLogics);
    }

    private void listLogics(Context ctx) {
        try {
            ctx.json(proofService.describeLogics());
        } catch (Exception e) {
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
