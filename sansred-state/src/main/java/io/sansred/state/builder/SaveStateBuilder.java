package io.sansred.state.builder;

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
import io.sansred.state.StateFragmentBuilder;
import io.sansred.state.fragment.SaveState;
import io.sansred.state.types.SaveType;

import java.util.List;

import static io.sansred.state.fragment.SaveState.*;

public class SaveStateBuilder extends StateFragmentBuilder<SaveState> {

    private List<SaveType> fileFormats;
    private String outputName;
    private String outputNameSuffix;
    private String outputDirectory;

    public SaveStateBuilder() {
        super(Concern.SAVE, SaveState.KEYS);
    }

    public SaveStateBuilder fileFormats(List<SaveType> formats) {
        this.fileFormats = formats;
        return this;
    }

    public SaveStateBuilder outputName(String name) {
        this.outputName = name;
        return this;
    }

    public SaveStateBuilder outputNameSuffix(String suffix) {
        this.outputNameSuffix = suffix;
        return this;
    }

    public SaveStateBuilder outputDirectory(String directory) {
        this.outputDirectory = directory;
        return this;
    }

    @Override
    protected void apply(String key, SettingsMap settings) {
        switch (key) {
            case FILE_FORMATS -> fileFormats(settings.getEnumList(key, SaveType.class));
            case OUTPUT_NAME -> outputName(settings.getString(key));
            case OUTPUT_NAME_SUFFIX -> outputNameSuffix(settings.getString(key));
            case OUTPUT_DIRECTORY -> outputDirectory(settings.getString(key));
            default -> throw new IllegalStateException("unhandled key " + key);
        }
    }

    @Override
    protected SaveState create() {
        List<SaveType> formats = fileFormats == null || fileFormats.isEmpty() ? List.of(SaveType.CSV) : fileFormats;
        return new SaveState(formats, outputName, outputNameSuffix, outputDirectory);
    }
}
