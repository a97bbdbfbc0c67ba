package io.nosqlbench.griddata.layout;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;

/// Shared YAML and JSON instances for layouts and reports.
public final class LayoutYaml {

    private LayoutYaml() {
    }

    /// gson instance
    public static final Gson gson = new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();
    private static final LoadSettings loadSettings = LoadSettings.builder().setLabel("layout").build();
    /// yaml loader instance
    public static final Load yamlLoader = new Load(loadSettings);
    private static final DumpSettings dumpSettings =
        DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build();
    /// yaml dumper instance
    public static final Dump yamlDumper = new Dump(dumpSettings);
}
