/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.support.routing;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.support.domain.model.AgentType;
import me.golemcore.support.domain.model.RoutingDecision;
import me.golemcore.support.domain.model.RoutingSource;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Deterministic keyword routing used when the model classification cannot be
 * trusted.
 *
 * <p>
 * Terms are matched at word starts, as stems or listed word forms, in the
 * customer message only. Precedence: escalation, then order, then FAQ as the
 * default. Never throws.
 */
@Component
@Slf4j
public class KeywordIntentMatcher {

    static final double ESCALATION_CONFIDENCE = 0.7;
    static final double ORDER_CONFIDENCE = 0.75;
    static final double DEFAULT_CONFIDENCE = 0.6;

    private static final int SUMMARY_MAX_CHARS = 100;

    // Stems cover inflections (pricing, cancellation, renewal); short words
    // that would over-match as stems (plan, fee, cost) list their forms.
    private static final Pattern ESCALATION_TERMS = Pattern.compile(
            "\\b(?:escalat\\w*|humans?|complex\\w*|complain\\w*|frustrat\\w*|angr\\w*|urgen\\w*"
                    + "|emergenc\\w*|managers?\\b|supervis\\w*|tickets?\\b"
                    + "|real\\s+(?:person|people)|speak\\s+to\\s+someone)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ORDER_TERMS = Pattern.compile(
            "\\b(?:subscri\\w*|bill(?:s|ed|ing)?\\b|invoic\\w*|pay(?:s|ing|ment|ments)?\\b|paid\\b|charg\\w*"
                    + "|plans?\\b|upgrad\\w*|downgrad\\w*|cancel\\w*|refund\\w*|accounts?\\b|pric\\w*"
                    + "|costs?\\b|costing\\b|fees?\\b|renew\\w*)",
            Pattern.CASE_INSENSITIVE);

    /**
     * Picks a specialist from the message text alone.
     */
    public RoutingDecision match(String message) {
        String text = message != null ? message : "";
        RoutingDecision decision;
        if (ESCALATION_TERMS.matcher(text).find()) {
            decision = decision(AgentType.ESCALATION, ESCALATION_CONFIDENCE, "Detected escalation keywords", text);
        } else if (ORDER_TERMS.matcher(text).find()) {
            decision = decision(AgentType.ORDER, ORDER_CONFIDENCE, "Detected billing/subscription keywords", text);
        } else {
            decision = decision(AgentType.FAQ, DEFAULT_CONFIDENCE, "Default routing to FAQ", text);
        }
        log.debug("[Router] Keyword match: {}", decision.getTarget());
        return decision;
    }

    private static RoutingDecision decision(AgentType target, double confidence, String reasoning, String text) {
        return RoutingDecision.builder()
                .target(target)
                .confidence(confidence)
                .reasoning(reasoning)
                .summary(text.length() <= SUMMARY_MAX_CHARS ? text : text.substring(0, SUMMARY_MAX_CHARS))
                .source(RoutingSource.FALLBACK)
                .build();
    }
}
