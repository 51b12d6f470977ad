package com.querycraft.generator;

import com.querycraft.config.NameResolver;
import com.querycraft.planner.DatasetAliases;
import com.querycraft.planner.DatasetAliases.ColumnReference;
import com.querycraft.planner.DatasetAliases.Occurrence;

import java.util.Objects;

import static com.querycraft.generator.SQLQuoting.quoteIdentifier;
import static com.querycraft.generator.SQLQuoting.quoteQualified;

/**
 * Renders column and table references of one request as quoted SQL.
 *
 * <p>Logical names are mapped to physical names through the {@link NameResolver};
 * columns are qualified with the alias of the dataset occurrence they belong to.
 */
public class ColumnResolver {

    private final DatasetAliases aliases;
    private final NameResolver names;

    public ColumnResolver(DatasetAliases aliases, NameResolver names) {
        this.aliases = Objects.requireNonNull(aliases, "aliases must not be null");
        this.names = Objects.requireNonNull(names, "names must not be null");
    }

    public DatasetAliases aliases() {
        return aliases;
    }

    /**
     * Renders a column reference qualified with its occurrence alias.
     *
     * <p>A qualifier that matches no dataset is kept as written.
     *
     * @param columnRef the reference, e.g. "REGION" or "DEPT.NAME"
     * @return e.g. {@code "DEPT"."DEPT_NAME"}, or an empty string for a blank reference
     */
    public String qualified(String columnRef) {
        ColumnReference ref = aliases.resolve(columnRef);
        if (ref == null) {
            return "";
        }
        if (!ref.isResolved()) {
            return quoteIdentifier(ref.qualifier() + "." + ref.column());
        }
        return qualified(ref.occurrence(), ref.column());
    }

    /**
     * Renders a column of a known occurrence.
     *
     * @param occurrence the dataset occurrence
     * @param column the logical column name, with or without a qualifier
     * @return the qualified physical column
     */
    public String qualified(Occurrence occurrence, String column) {
        String bare = bareName(column);
        return quoteQualified(occurrence.alias(), names.physicalColumn(occurrence.dataset(), bare));
    }

    /**
     * Renders a column without qualifier, for use inside a derived source of its dataset.
     *
     * @param dataset the dataset the column belongs to
     * @param column the logical column name, with or without a qualifier
     * @return e.g. {@code "REGION"}
     */
    public String local(String dataset, String column) {
        return quoteIdentifier(names.physicalColumn(dataset, bareName(column)));
    }

    /**
     * Renders the physical table of an occurrence.
     *
     * @param occurrence the occurrence
     * @return e.g. {@code "HR"."EMP_MASTER"}
     */
    public String table(Occurrence occurrence) {
        return quoteIdentifier(names.physicalTable(occurrence.dataset()));
    }

    static String bareName(String column) {
        int dot = column.lastIndexOf('.');
        return dot >= 0 ? column.substring(dot + 1) : column;
    }
}
