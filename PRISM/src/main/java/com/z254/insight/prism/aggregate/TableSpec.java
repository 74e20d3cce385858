package com.z254.insight.prism.aggregate;

import lombok.NonNull;
import lombok.Value;

/**
 * A requested category x bucket pairing.
 */
@Value
public class TableSpec {

    @NonNull
    CategoryDimension category;

    @NonNull
    BucketDimension bucket;

    /** e.g. {@code integration_app_by_month} */
    public String getName() {
        return category.getKey() + "_by_" + bucket.getKey();
    }
}
