package io.sansred.state.fragment;

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

import io.sansred.state.Concern;
import io.sansred.state.SettingsMap;
import io.sansred.state.StateFragment;
import io.sansred.state.types.SaveType;

import java.util.List;

/// Output naming and the formats written when outputs are saved to file.
public record SaveState(
    List<SaveType> fileFormats,
    String outputName,
    String outputNameSuffix,
    String outputDirectory
) implements StateFragment {

    public static final String FILE_FORMATS = "save_file_formats";
    public static final String OUTPUT_NAME = "output_name";
    public static final String OUTPUT_NAME_SUFFIX = "output_name_suffix";
    public static final String OUTPUT_DIRECTORY = "output_directory";

    public static final List<String> KEYS = List.of(FILE_FORMATS, OUTPUT_NAME, OUTPUT_NAME_SUFFIX, OUTPUT_DIRECTORY);

    public SaveState {
        fileFormats = Fragments.copy(fileFormats);
    }

    @Override
    public Concern concern() {
        return Concern.SAVE;
    }

    @Override
    public void validate() {
        Violations v = new Violations(Concern.SAVE);
        v.require(fileFormats, FILE_FORMATS);
        v.check(outputName == null || !outputName.contains("/") && !outputName.contains("\\"),
            OUTPUT_NAME, "must not contain path separators");
        v.throwIfAny();
    }

    @Override
    public boolean isDisabled() {
        return false;
    }

    @Override
    public SettingsMap toSettings() {
        return Fragments.settings(FILE_FORMATS, fileFormats, OUTPUT_NAME, outputName,
            OUTPUT_NAME_SUFFIX, outputNameSuffix, OUTPUT_DIRECTORY, outputDirectory);
    }
}
