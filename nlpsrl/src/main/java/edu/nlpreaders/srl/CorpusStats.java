package edu.nlpreaders.srl;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.Arrays;
import java.util.List;

/**
 * Counts of a read corpus: sentences, tokens, predicates, arguments, and
 * arguments per role label.
 */
public class CorpusStats {

    int sentenceCount;
    int tokenCount;
    int predicateCount;
    int argumentCount;
    TObjectIntMap<String> roleCounts;

    public CorpusStats() {
        roleCounts = new TObjectIntHashMap<String>();
    }

    public CorpusStats(List<SrlSentence> sentences) {
        this();
        for (SrlSentence sentence:sentences)
            add(sentence);
    }

    public void add(SrlSentence sentence) {
        ++sentenceCount;
        tokenCount += sentence.size();
        for (Predicate predicate:sentence.getPredicates()) {
            ++predicateCount;
            for (Argument argument:predicate.getArguments()) {
                ++argumentCount;
                roleCounts.adjustOrPutValue(argument.getRole(), 1, 1);
            }
        }
    }

    public int getSentenceCount() {
        return sentenceCount;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public int getPredicateCount() {
        return predicateCount;
    }

    public int getArgumentCount() {
        return argumentCount;
    }

    public int getRoleCount(String role) {
        return roleCounts.get(role);
    }

    public String[] getRoles() {
        String[] roles = roleCounts.keys(new String[roleCounts.size()]);
        Arrays.sort(roles);
        return roles;
    }

    @Override
    public String toString() {
        StringBuilder buffer = new StringBuilder();
        buffer.append(String.format("sentences: %d, tokens: %d, predicates: %d, arguments: %d\n",
                sentenceCount, tokenCount, predicateCount, argumentCount));
        for (String role:getRoles())
            buffer.append(String.format("  %-12s %d\n", role, roleCounts.get(role)));
        return buffer.toString();
    }
}
