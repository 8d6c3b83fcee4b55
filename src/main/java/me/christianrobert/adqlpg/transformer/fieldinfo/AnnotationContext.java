package me.christianrobert.adqlpg.transformer.fieldinfo;

import me.christianrobert.adqlpg.transformer.context.ColumnNotFoundException;
import me.christianrobert.adqlpg.transformer.context.TableNotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * State of one annotation run: the catalog, a stack of column resolvers (one per
 * query nesting level) and the errors and warnings collected on the way.
 * <p>
 * A column is resolved by the innermost resolver first. If it does not know
 * the column or qualifier, enclosing queries are asked, which gives correlated
 * subqueries access to outer columns. Ambiguity is never retried outward.
 * </p>
 */
public class AnnotationContext {

    private final TableCatalog catalog;
    private final Deque<ColumnResolver> resolvers = new ArrayDeque<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public AnnotationContext(TableCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("Table catalog cannot be null");
        }
        this.catalog = catalog;
    }

    public TableCatalog getCatalog() {
        return catalog;
    }

    public void pushResolver(ColumnResolver resolver) {
        resolvers.push(resolver);
    }

    public void popResolver() {
        resolvers.pop();
    }

    public int getResolverDepth() {
        return resolvers.size();
    }

    public FieldInfo getFieldInfo(String normalizedName, String qualifier) {
        if (resolvers.isEmpty()) {
            throw new ColumnNotFoundException("No columns visible for " + normalizedName, normalizedName);
        }
        RuntimeException innermostFailure = null;
        Iterator<ColumnResolver> it = resolvers.iterator();
        while (it.hasNext()) {
            try {
                return it.next().resolve(normalizedName, qualifier);
            } catch (ColumnNotFoundException | TableNotFoundException e) {
                if (innermostFailure == null) {
                    innermostFailure = e;
                }
            }
        }
        throw innermostFailure;
    }

    public void addError(String message) {
        errors.add(message);
    }

    public void addWarning(String message) {
        warnings.add(message);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Errors followed by warnings; errors are not fatal for a translation.
     */
    public List<String> getDiagnostics() {
        List<String> result = new ArrayList<>(errors);
        result.addAll(warnings);
        return result;
    }
}
