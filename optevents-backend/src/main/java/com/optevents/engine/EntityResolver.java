package com.optevents.engine;

import com.optevents.client.DataSet;
import com.optevents.model.FilterCriteria;
import com.optevents.query.FilterCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves namespace/workload scoping into the matching optimizer ids.
 */
@Component
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final FilterCompiler filterCompiler;
    private final Paginator paginator;

    public EntityResolver(FilterCompiler filterCompiler, Paginator paginator) {
        this.filterCompiler = filterCompiler;
        this.paginator = paginator;
    }

    /**
     * Looks up the optimizer ids of all optimization entities matching the criteria, across all
     * pages.
     *
     * @param criteria criteria with a namespace or workload name
     * @return ids in the order returned; empty when nothing matches
     * @throws IllegalArgumentException if neither namespace nor workload name is set
     */
    public List<String> resolveOptimizerIds(FilterCriteria criteria) {
        if (!criteria.hasEntityScope()) {
            throw new IllegalArgumentException(
                    "optimizations query must at least filter on namespace or workload name, otherwise it can be skipped");
        }

        Paginator.PageSet<String> ids = paginator.execute(
                filterCompiler.entityLookupQuery(criteria), this::readIds, true);
        log.debug("Resolved {} optimizer ids (namespace={}, workload_name={}, cluster_id={})",
                ids.getRows().size(), criteria.getNamespace(), criteria.getWorkloadName(), criteria.getClusterId());
        return ids.getRows();
    }

    /**
     * Builds the predicate for the criteria, resolving entities when scoped by namespace or
     * workload.
     *
     * @param criteria criteria
     * @return predicate, or empty if the entity lookup matched nothing and no query should run
     */
    public Optional<String> resolveFilter(FilterCriteria criteria) {
        if (criteria.hasOptimizerId() || !criteria.hasEntityScope()) {
            return Optional.of(filterCompiler.compileFilter(criteria, null));
        }

        List<String> optimizerIds = resolveOptimizerIds(criteria);
        if (optimizerIds.isEmpty()) {
            log.info("No optimization entities found (namespace={}, workload_name={}, cluster_id={})",
                    criteria.getNamespace(), criteria.getWorkloadName(), criteria.getClusterId());
            return Optional.empty();
        }
        return Optional.of(filterCompiler.compileFilter(criteria, optimizerIds));
    }

    private Paginator.Page<String> readIds(DataSet main, int page) {
        List<String> out = new ArrayList<>(main.rowCount());
        int index = 0;
        for (List<Object> row : main.getData()) {
            if (row == null || row.isEmpty()) {
                throw new DataShapeException(String.format("page %d optimization data row %d has no columns", page, index));
            }
            Object value = row.get(0);
            if (!(value instanceof String id)) {
                throw new DataShapeException(String.format(
                        "page %d optimization data row %d value %s (type %s) could not be converted to string",
                        page, index, value, ResultExtractor.typeName(value)));
            }
            out.add(id);
            index++;
        }
        return new Paginator.Page<>(out, main);
    }
}
