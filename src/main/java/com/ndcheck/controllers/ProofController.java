package com.ndcheck.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndcheck.AppLogger;
import com.ndcheck.ProofService;
import com.ndcheck.models.CheckProofRequest;
import com.ndcheck.models.CheckProofResponse;
import com.ndcheck.models.StepDescriptor;
import com.ndcheck.models.ValidateProblemRequest;
import com.ndcheck.proof.ProofResult;
import com.ndcheck.storage.EditorLineCodec;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.List;
import java.util.Map;

/**
 * Controller for problem validation and proof checking.
 */
public class ProofController implements Controller {

    private final ProofService proofService;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ProofController(ProofService proofService, ObjectMapper objectMapper) {
        this.proofService = proofService;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/validate-problem", this::validateProblem);
        app.post("/api/check-proof", this::checkProof);
    }

    private void validateProblem(Context ctx) {
        try {
            ValidateProblemRequest request = objectMapper.readValue(ctx.body(), ValidateProblemRequest.class);
            proofService.validateProblem(request.getLogic(), request.getPremisesText(), request.getConclusionText());
            ctx.json(Map.of("ok", true, "status", "ok", "message", ""));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Controller.errorBody(new IllegalArgumentException("Malformed request body.")));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error validating problem: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void checkProof(Context ctx) {
        try {
            CheckProofRequest request = objectMapper.readValue(ctx.body(), CheckProofRequest.class);
            List<StepDescriptor> steps = request.getLines();
            if (steps.isEmpty() && !request.getTuples().isEmpty()) {
                steps = EditorLineCodec.decode(request.getTuples());
            }
            ProofResult result = proofService.checkProof(request.getLogic(), request.getPremisesText(),
                request.getConclusionText(), steps);
            ctx.json(CheckProofResponse.from(result));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Controller.errorBody(new IllegalArgumentException("Malformed request body.")));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Error checking proof: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
