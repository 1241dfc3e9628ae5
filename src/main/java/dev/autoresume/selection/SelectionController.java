package dev.autoresume.selection;

import dev.autoresume.config.ResumeConfig;
import dev.autoresume.model.RankedRepository;
import dev.autoresume.model.SelectionOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Human checkpoint between ranking and generation. Blocks on terminal input
 * until the user freezes a selection or aborts; no timeout applies.
 */
@Component
@RequiredArgsConstructor
public class SelectionController {

    private final SelectionConsole console;
    private final ResumeConfig resumeConfig;

    public SelectionOutcome select(List<RankedRepository> ranked) {
        int defaultCount = Math.max(1, resumeConfig.getSelection().getDefaultCount());
        return new SelectionSession(ranked, console, defaultCount).run();
    }
}
