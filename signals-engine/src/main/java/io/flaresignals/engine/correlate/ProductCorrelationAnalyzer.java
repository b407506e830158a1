package io.flaresignals.engine.correlate;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.flaresignals.engine.AnalyzerName;
import io.flaresignals.engine.config.CorrelationConfig;
import io.flaresignals.engine.model.TagCategory;

/// Correlates skincare product tags with the skin intensity that follows them.
@AnalyzerName(ProductCorrelationAnalyzer.ANALYZER_TYPE)
public final class ProductCorrelationAnalyzer extends CorrelationAnalyzer {

    public static final String ANALYZER_TYPE = "product-correlation";

    public ProductCorrelationAnalyzer() {
        this(CorrelationConfig.defaults());
    }

    public ProductCorrelationAnalyzer(CorrelationConfig config) {
        super(TagCategory.PRODUCT, config);
    }

    @Override
    public String getAnalyzerType() {
        return ANALYZER_TYPE;
    }
}
