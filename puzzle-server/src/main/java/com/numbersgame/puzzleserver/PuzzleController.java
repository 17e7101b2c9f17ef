package com.numbersgame.puzzleserver;

import com.fasterxml.jackson.databind.JsonNode;
import com.numbersgame.puzzleserver.engine.CheckResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/puzzle")
@CrossOrigin(origins = "*")
public class PuzzleController {

    private final PuzzleService puzzleService;

    public PuzzleController(PuzzleService puzzleService) {
        this.puzzleService = puzzleService;
    }

    @GetMapping("/new")
    public ResponseEntity<PuzzleResponse> newPuzzle(
            @RequestParam(name = "num_operands", defaultValue = "${puzzle.defaults.num-operands:5}") int numOperands,
            @RequestParam(name = "decoys", defaultValue = "${puzzle.defaults.decoys:1}") int decoys,
            @RequestParam(name = "show_solution", defaultValue = "false") boolean showSolution,
            @RequestParam(name = "target_min", defaultValue = "${puzzle.defaults.target-min:10}") long targetMin,
            @RequestParam(name = "target_max", defaultValue = "${puzzle.defaults.target-max:150}") long targetMax,
            @RequestParam(name = "require_parens_prob", defaultValue = "${puzzle.defaults.require-parens-prob:0.6}") double requireParensProb) {

        GenerationOptions options = new GenerationOptions(numOperands, decoys, targetMin, targetMax, requireParensProb);
        return ResponseEntity.ok(puzzleService.newPuzzle(options, showSolution));
    }

    @PostMapping("/check")
    public ResponseEntity<CheckResult> check(@RequestBody JsonNode payload) {
        return ResponseEntity.ok(puzzleService.check(payload));
    }

    @GetMapping("/reveal")
    public Map<String, String> reveal(@RequestParam("round_id") String roundId) {
        return Map.of("solution", puzzleService.reveal(roundId));
    }
}
