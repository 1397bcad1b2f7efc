package teranet.mapdev.listings.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.listings.transformer.CategoricalColumnTransformer;
import teranet.mapdev.listings.transformer.ColumnNameTransformer;
import teranet.mapdev.listings.transformer.DateColumnTransformer;
import teranet.mapdev.listings.transformer.DuplicateRowTransformer;
import teranet.mapdev.listings.transformer.EmptyRowTransformer;
import teranet.mapdev.listings.transformer.FeatureTransformer;
import teranet.mapdev.listings.transformer.MissingColumnTransformer;
import teranet.mapdev.listings.transformer.NumericColumnTransformer;
import teranet.mapdev.listings.transformer.TableTransformer;

import java.util.List;

/**
 * Factory for the ordered chain of transformation stages.
 *
 * The order is fixed:
 * 1. normalize column names
 * 2. drop empty rows
 * 3. drop duplicate rows
 * 4. drop sparse columns
 * 5. numeric cleaning
 * 6. categorical cleaning
 * 7. date parsing
 * 8. derived features
 *
 * Stages are stateless, so one chain instance is shared by every pass.
 */
@Service
@Slf4j
public class TransformerChainFactory {

    private final List<TableTransformer> chain = List.of(
            new ColumnNameTransformer(),
            new EmptyRowTransformer(),
            new DuplicateRowTransformer(),
            new MissingColumnTransformer(),
            new NumericColumnTransformer(),
            new CategoricalColumnTransformer(),
            new DateColumnTransformer(),
            new FeatureTransformer());

    public List<TableTransformer> getChain() {
        log.debug("Transformation chain: {} stages", chain.size());
        return chain;
    }
}
