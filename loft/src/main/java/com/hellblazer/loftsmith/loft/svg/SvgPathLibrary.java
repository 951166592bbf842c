/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.loftsmith.loft.svg;

import com.hellblazer.loftsmith.geometry.Polyline;
import com.hellblazer.loftsmith.loft.path.PathParser;
import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts the named {@code path} elements of a vector drawing as flattened polylines, keyed by element id in
 * document order. Elements without an id are named {@code path_<n>}, n being the number of paths collected so far;
 * a repeated id replaces the earlier path.
 *
 * @author hal.hildebrand
 */
public class SvgPathLibrary {
    private static final Logger log = LoggerFactory.getLogger(SvgPathLibrary.class);

    private final PathParser parser;

    public SvgPathLibrary() {
        this(new PathParser());
    }

    public SvgPathLibrary(PathParser parser) {
        this.parser = parser;
    }

    public Map<String, Polyline> load(Path file) throws IOException {
        var paths = parse(Files.readString(file));
        log.info("{}: {} paths", file.getFileName(), paths.size());
        return paths;
    }

    public Map<String, Polyline> parse(String content) {
        var document = Jsoup.parse(content, "", Parser.xmlParser());
        var paths = new LinkedHashMap<String, Polyline>();
        for (var element : document.getElementsByTag("path")) {
            if (!element.hasAttr("d")) {
                continue;
            }
            var d = element.attr("d");
            var id = element.hasAttr("id") ? element.attr("id") : "path_" + paths.size();
            var polyline = parser.parse(d);
            log.debug("Parsed path '{}' into {} points", id, polyline.size());
            paths.put(id, polyline);
        }
        return paths;
    }
}
