package com.example.rublimp.generator.sentence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable dependency-annotated sentence. Tokens are stored in an array and refer to their
 * heads by position, so the tree can be queried in both directions without object links.
 */
public final class AnnotatedSentence {

    private static final Set<String> QUOTES = Set.of("\"", "«", "»", "“", "”", "„", "'");

    private final String id;
    private final String text;
    private final List<Token> tokens;
    private final List<List<Token>> children;
    private final Token root;

    private AnnotatedSentence(String id, String text, List<Token> tokens,
                              List<List<Token>> children, Token root) {
        this.id = id;
        this.text = text;
        this.tokens = tokens;
        this.children = children;
        this.root = root;
    }

    /**
     * Validates the tree and builds the sentence.
     *
     * @throws MalformedSentenceException when positions are not 1..n, a head is out of range, the
     *                                    tree has zero or several roots, or a cycle exists
     */
    public static AnnotatedSentence of(String id, String text, List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        String sentenceId = id == null ? "<unnamed>" : id;
        if (tokens.isEmpty()) {
            throw new MalformedSentenceException(sentenceId, "no tokens");
        }
        List<Token> copy = List.copyOf(tokens);
        int size = copy.size();
        List<List<Token>> children = new ArrayList<>(size + 1);
        for (int i = 0; i <= size; i++) {
            children.add(new ArrayList<>());
        }
        Token root = null;
        for (int i = 0; i < size; i++) {
            Token token = copy.get(i);
            if (token.index() != i + 1) {
                throw new MalformedSentenceException(sentenceId,
                        "token " + token.form() + " has position " + token.index() + ", expected " + (i + 1));
            }
            if (token.head() < 0 || token.head() > size) {
                throw new MalformedSentenceException(sentenceId,
                        "head " + token.head() + " of token " + token.index() + " is out of range");
            }
            if (token.head() == token.index()) {
                throw new MalformedSentenceException(sentenceId, "token " + token.index() + " heads itself");
            }
            if (token.isRoot()) {
                if (root != null) {
                    throw new MalformedSentenceException(sentenceId,
                            "several roots: " + root.index() + " and " + token.index());
                }
                root = token;
            }
            children.get(token.head()).add(token);
        }
        if (root == null) {
            throw new MalformedSentenceException(sentenceId, "no root");
        }
        List<List<Token>> frozen = new ArrayList<>(size + 1);
        for (List<Token> list : children) {
            frozen.add(Collections.unmodifiableList(list));
        }
        AnnotatedSentence sentence = new AnnotatedSentence(sentenceId, text, copy,
                Collections.unmodifiableList(frozen), root);
        sentence.checkReachability();
        return sentence;
    }

    private void checkReachability() {
        boolean[] seen = new boolean[tokens.size() + 1];
        Deque<Token> queue = new ArrayDeque<>();
        queue.add(root);
        int visited = 0;
        while (!queue.isEmpty()) {
            Token current = queue.poll();
            if (seen[current.index()]) {
                continue;
            }
            seen[current.index()] = true;
            visited++;
            queue.addAll(children.get(current.index()));
        }
        if (visited != tokens.size()) {
            throw new MalformedSentenceException(id, "cycle detected, only " + visited + " of "
                    + tokens.size() + " tokens reachable from the root");
        }
    }

    public String id() {
        return id;
    }

    /**
     * Original text from the {@code # text} comment, or the rendered tokens when absent.
     */
    public String text() {
        return text != null ? text : render();
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token root() {
        return root;
    }

    /**
     * Token at a 1-based position.
     */
    public Token token(int index) {
        return tokens.get(index - 1);
    }

    public Optional<Token> head(Token token) {
        return token.isRoot() ? Optional.empty() : Optional.of(token(token.head()));
    }

    public List<Token> dependents(Token token) {
        return children.get(token.index());
    }

    public List<Token> dependents(Token token, String relation) {
        List<Token> result = new ArrayList<>();
        for (Token child : children.get(token.index())) {
            if (child.hasRelation(relation)) {
                result.add(child);
            }
        }
        return result;
    }

    public Optional<Token> firstDependent(Token token, Predicate<Token> predicate) {
        for (Token child : children.get(token.index())) {
            if (predicate.test(child)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public boolean hasDependent(Token token, Predicate<Token> predicate) {
        return firstDependent(token, predicate).isPresent();
    }

    public List<Token> siblings(Token token) {
        if (token.isRoot()) {
            return List.of();
        }
        List<Token> result = new ArrayList<>();
        for (Token child : children.get(token.head())) {
            if (child.index() != token.index()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * A token takes part in coordination when it is attached as {@code conj} or has conjuncts.
     */
    public boolean isConjunct(Token token) {
        return token.hasRelation("conj") || hasDependent(token, child -> child.hasRelation("conj"));
    }

    public boolean isDescendant(Token node, Token ancestor) {
        Token current = node;
        while (!current.isRoot()) {
            current = token(current.head());
            if (current.index() == ancestor.index()) {
                return true;
            }
        }
        return false;
    }

    public int depth(Token token) {
        int depth = 0;
        Token current = token;
        while (!current.isRoot()) {
            current = token(current.head());
            depth++;
        }
        return depth;
    }

    /**
     * Number of edges on the tree path between two tokens.
     */
    public int pathLength(Token a, Token b) {
        List<Integer> upFromA = pathToRoot(a);
        List<Integer> upFromB = pathToRoot(b);
        for (int i = 0; i < upFromA.size(); i++) {
            int j = upFromB.indexOf(upFromA.get(i));
            if (j >= 0) {
                return i + j;
            }
        }
        throw new IllegalStateException("Tokens do not share the root in sentence " + id);
    }

    private List<Integer> pathToRoot(Token token) {
        List<Integer> path = new ArrayList<>();
        Token current = token;
        path.add(current.index());
        while (!current.isRoot()) {
            current = token(current.head());
            path.add(current.index());
        }
        return path;
    }

    /**
     * Number of tokens on the longest root-to-leaf path.
     */
    public int treeDepth() {
        int max = 0;
        for (Token token : tokens) {
            if (children.get(token.index()).isEmpty()) {
                max = Math.max(max, depth(token) + 1);
            }
        }
        return max;
    }

    /**
     * Tokens strictly between two positions, in sentence order.
     */
    public List<Token> between(Token a, Token b) {
        int from = Math.min(a.index(), b.index());
        int to = Math.max(a.index(), b.index());
        if (to - from <= 1) {
            return List.of();
        }
        return tokens.subList(from, to - 1);
    }

    /**
     * True when the token's subtree is enclosed in quotation marks.
     */
    public boolean isQuoted(Token token) {
        int first = token.index();
        int last = token.index();
        for (Token candidate : tokens) {
            if (candidate.index() == token.index() || isDescendant(candidate, token)) {
                first = Math.min(first, candidate.index());
                last = Math.max(last, candidate.index());
            }
        }
        boolean openBefore = first > 1 && QUOTES.contains(token(first - 1).form());
        boolean closeAfter = last < tokens.size() && QUOTES.contains(token(last + 1).form());
        return openBefore && closeAfter;
    }

    public String render() {
        return render(Map.of());
    }

    /**
     * Joins token forms honouring {@code SpaceAfter=No}, substituting forms by position.
     */
    public String render(Map<Integer, String> replacements) {
        StringBuilder builder = new StringBuilder();
        for (Token token : tokens) {
            builder.append(replacements.getOrDefault(token.index(), token.form()));
            if (token.spaceAfter() && token.index() < tokens.size()) {
                builder.append(' ');
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return id + ": " + render();
    }
}
