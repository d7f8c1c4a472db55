package me.golemcore.scheduler.adapter.outbound.runstore;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scheduler.domain.model.RunStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class RunStatusArgumentFactory extends AbstractArgumentFactory<RunStatus> {

    public RunStatusArgumentFactory() {
        super(Types.INTEGER);
    }

    @Override
    protected Argument build(RunStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setInt(position, value.code());
    }
}
