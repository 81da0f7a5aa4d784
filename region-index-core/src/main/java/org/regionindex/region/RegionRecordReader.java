/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.regionindex.region;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** 读取 ETL 产出的区域记录 JSON 数组。 */
public class RegionRecordReader {

    private static final Logger LOG = LoggerFactory.getLogger(RegionRecordReader.class);

    private static final TypeReference<List<RegionRecord>> RECORD_LIST =
            new TypeReference<List<RegionRecord>>() {};

    private final ObjectMapper mapper;

    public RegionRecordReader() {
        this.mapper =
                new ObjectMapper()
                        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                        .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false)
                        .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    public List<RegionRecord> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            List<RegionRecord> records = read(in);
            LOG.info("Read {} region records from {}.", records.size(), path);
            return records;
        }
    }

    /**
     * 从输入流读取记录,不关闭流。
     *
     * @throws IOException 读取失败或 JSON 不合法时抛出
     */
    public List<RegionRecord> read(InputStream in) throws IOException {
        List<RegionRecord> records = mapper.readValue(in, RECORD_LIST);
        if (records == null) {
            throw new IOException("Region record input is empty JSON null.");
        }
        return records;
    }

    /** 以 JSON 数组写出记录,不关闭流。 */
    public void write(List<RegionRecord> records, OutputStream out) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(out, records);
    }
}
