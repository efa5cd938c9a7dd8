package com.mathide.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.core.candidate.Candidate;
import com.mathide.core.candidate.CandidateRanker;
import com.mathide.exception.MissingFieldException;
import com.mathide.llm.LLMClient;
import com.mathide.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * CandidateGenerator - asks the model which transformations could be applied next.
 *
 * PIPELINE:
 * 1. Prompt with the current expression
 * 2. Locate and decode the JSON array
 * 3. Drop elements that are not records or lack description, expression or kind
 * 4. Rank by usefulness (good, neutral, anything else), stable within a rank
 * 5. Keep the top maxCandidates and shuffle them
 * 6. In preview mode, stamp previewResult with the candidate's expression
 *
 * A reply with no usable payload throws; a payload whose every element is dropped yields
 * an empty result.
 */
@Component
public class CandidateGenerator extends ModelBackedEngine {

    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    static final String TRANSFORMATION_KINDS = """
            - `add` - add the same quantity to both sides or combine sums
            - `subtract` - subtract the same quantity from both sides
            - `multiply` - multiply both sides or expressions
            - `divide` - divide both sides or expressions
            - `factor` - factor an expression
            - `expand` - expand brackets
            - `collect_terms` - collect like terms
            - `substitute` - substitute a value or expression
            - `expand_cases` - split into cases, e.g. for |x|
            - `simplify` - simplify an expression
            - `custom` - anything else that is relevant
            """;

    private static final String USER_TEMPLATE = """
            Current state of the solution:
            %s

            Propose the transformations a student could apply next. Useful kinds include:
            %s
            Return a JSON array. Each element:
            {
              "description": "what the transformation does, in one sentence",
              "expression": "the expression after applying it",
              "kind": "one of the kinds above or another short tag",
              "metadata": {"usefulness": "good" | "neutral" | "bad"},
              "requires_user_input": false,
              "parameter_definitions": []
            }
            When the transformation needs a value from the student (e.g. what to multiply by),
            set "requires_user_input" to true, use a {name} placeholder in description and
            expression, and describe each parameter as
            {"name", "prompt", "param_type": "number" | "text" | "choice" | "expression",
             "options"?, "default_value"?, "validation_rule"?, "suggested_values"?}.
            """;

    private final int     maxCandidates;
    private final boolean previewMode;
    private final Random  random;

    @Autowired
    public CandidateGenerator(
            LLMClient llmClient,
            @Value("${mathide.generation.max-candidates:5}") int maxCandidates,
            @Value("${mathide.generation.preview-mode:false}") boolean previewMode
    ) {
        this(llmClient, maxCandidates, previewMode, new Random());
    }

    public CandidateGenerator(LLMClient llmClient, int maxCandidates, boolean previewMode, Random random) {
        super(llmClient);
        this.maxCandidates = maxCandidates;
        this.previewMode   = previewMode;
        this.random        = random;
    }

    public GenerationResult generate(String expression) {
        log.info("[Generator] Generating candidates for: {}", expression);

        JsonNode elements = requestArray(
                ModelRole.GENERATOR,
                JSON_ONLY_PERSONA,
                USER_TEMPLATE.formatted(expression, TRANSFORMATION_KINDS));

        List<Candidate> parsed = new ArrayList<>();
        int index = 0;
        for (JsonNode element : elements) {
            try {
                parsed.add(Candidate.fromJson(element));
            } catch (MissingFieldException e) {
                log.warn("[Generator] Dropping element {}: {}", index, e.getMessage());
            }
            index++;
        }

        List<Candidate> selected = CandidateRanker.select(parsed, maxCandidates, random);

        if (previewMode) {
            List<Candidate> previewed = new ArrayList<>(selected.size());
            for (Candidate c : selected) {
                previewed.add(c.withPreviewResult(c.getExpression()));
            }
            selected = previewed;
        }

        int dropped = elements.size() - parsed.size();
        log.info("[Generator] {} decoded, {} dropped, {} presented",
                elements.size(), dropped, selected.size());

        return new GenerationResult(selected, elements.size(), dropped);
    }

    public boolean isPreviewMode() {
        return previewMode;
    }
}
