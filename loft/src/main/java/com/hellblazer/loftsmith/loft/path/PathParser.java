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

package com.hellblazer.loftsmith.loft.path;

import com.hellblazer.loftsmith.geometry.Point2;
import com.hellblazer.loftsmith.geometry.Polyline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens a vector path command string (the {@code d} attribute convention) into a {@link Polyline}.
 * <p>
 * Supported commands are {@code M L H V C Q S T Z}, uppercase absolute and lowercase relative. Cubic segments are
 * sampled at {@value #CUBIC_STEPS} uniform parameter steps and quadratic segments at {@value #QUADRATIC_STEPS};
 * the segment start is never re-emitted. Argument groups that are too short are dropped without emitting
 * anything, and unsupported commands are ignored.
 *
 * @author hal.hildebrand
 */
public class PathParser {

    public static final int CUBIC_STEPS     = 8;
    public static final int QUADRATIC_STEPS = 6;

    private static final Logger  log         = LoggerFactory.getLogger(PathParser.class);
    private static final Pattern NUMBER      = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");
    private static final String  COMMANDS    = "MmLlHhVvCcQqSsTtZzAa";
    private static final Pattern SEPARATORS  = Pattern.compile("[\\s,]*");

    /**
     * Evaluate the cubic Bézier {@code p0 p1 p2 p3} at parameter {@code t}.
     */
    public static Point2 cubic(Point2 p0, Point2 p1, Point2 p2, Point2 p3, double t) {
        var u = 1 - t;
        var b0 = u * u * u;
        var b1 = 3 * u * u * t;
        var b2 = 3 * u * t * t;
        var b3 = t * t * t;
        return new Point2(b0 * p0.x() + b1 * p1.x() + b2 * p2.x() + b3 * p3.x(),
                          b0 * p0.y() + b1 * p1.y() + b2 * p2.y() + b3 * p3.y());
    }

    /**
     * Evaluate the quadratic Bézier {@code p0 p1 p2} at parameter {@code t}.
     */
    public static Point2 quadratic(Point2 p0, Point2 p1, Point2 p2, double t) {
        var u = 1 - t;
        var b0 = u * u;
        var b1 = 2 * u * t;
        var b2 = t * t;
        return new Point2(b0 * p0.x() + b1 * p1.x() + b2 * p2.x(), b0 * p0.y() + b1 * p1.y() + b2 * p2.y());
    }

    public Polyline parse(String d) {
        if (d == null || d.isBlank()) {
            return Polyline.empty();
        }
        var cursor = new PathCursor();
        for (var command : split(d)) {
            apply(cursor, command);
        }
        return Polyline.of(cursor.points());
    }

    private void apply(PathCursor cursor, Command command) {
        var nums = command.args();
        var rel = command.relative();
        switch (Character.toUpperCase(command.letter())) {
            case 'M' -> {
                for (int i = 0; i + 1 < nums.length; i += 2) {
                    cursor.lineTo(cursor.resolve(rel, nums[i], nums[i + 1]));
                    if (i == 0) {
                        cursor.markSubpathStart();
                    }
                }
                cursor.clearControlPoint();
            }
            case 'L' -> {
                for (int i = 0; i + 1 < nums.length; i += 2) {
                    cursor.lineTo(cursor.resolve(rel, nums[i], nums[i + 1]));
                }
                cursor.clearControlPoint();
            }
            case 'H' -> {
                for (var n : nums) {
                    cursor.lineTo(new Point2(rel ? cursor.currentX() + n : n, cursor.currentY()));
                }
                cursor.clearControlPoint();
            }
            case 'V' -> {
                for (var n : nums) {
                    cursor.lineTo(new Point2(cursor.currentX(), rel ? cursor.currentY() + n : n));
                }
                cursor.clearControlPoint();
            }
            case 'C' -> {
                for (int i = 0; i + 5 < nums.length; i += 6) {
                    var p1 = cursor.resolve(rel, nums[i], nums[i + 1]);
                    var p2 = cursor.resolve(rel, nums[i + 2], nums[i + 3]);
                    var p3 = cursor.resolve(rel, nums[i + 4], nums[i + 5]);
                    cubicTo(cursor, p1, p2, p3);
                }
            }
            case 'S' -> {
                for (int i = 0; i + 3 < nums.length; i += 4) {
                    var p1 = cursor.reflectedControlPoint();
                    var p2 = cursor.resolve(rel, nums[i], nums[i + 1]);
                    var p3 = cursor.resolve(rel, nums[i + 2], nums[i + 3]);
                    cubicTo(cursor, p1, p2, p3);
                }
            }
            case 'Q' -> {
                for (int i = 0; i + 3 < nums.length; i += 4) {
                    var p1 = cursor.resolve(rel, nums[i], nums[i + 1]);
                    var p2 = cursor.resolve(rel, nums[i + 2], nums[i + 3]);
                    quadraticTo(cursor, p1, p2);
                }
            }
            case 'T' -> {
                for (int i = 0; i + 1 < nums.length; i += 2) {
                    var p1 = cursor.reflectedControlPoint();
                    var p2 = cursor.resolve(rel, nums[i], nums[i + 1]);
                    quadraticTo(cursor, p1, p2);
                }
            }
            case 'Z' -> cursor.close();
            default -> log.debug("Ignoring unsupported path command '{}'", command.letter());
        }
    }

    private void cubicTo(PathCursor cursor, Point2 p1, Point2 p2, Point2 p3) {
        var p0 = cursor.current();
        for (int step = 1; step <= CUBIC_STEPS; step++) {
            cursor.emit(cubic(p0, p1, p2, p3, (double) step / CUBIC_STEPS));
        }
        cursor.setControlPoint(p2);
        cursor.advanceTo(p3);
    }

    private double[] numbers(String text, char letter) {
        var values = new ArrayList<Double>();
        var matcher = NUMBER.matcher(text);
        int last = 0;
        while (matcher.find()) {
            checkGap(text.substring(last, matcher.start()), letter);
            values.add(Double.parseDouble(matcher.group()));
            last = matcher.end();
        }
        checkGap(text.substring(last), letter);
        var result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    private void checkGap(String gap, char letter) {
        if (!SEPARATORS.matcher(gap).matches()) {
            log.debug("Skipping malformed token '{}' in '{}' command", gap.trim(), letter);
        }
    }

    private void quadraticTo(PathCursor cursor, Point2 p1, Point2 p2) {
        var p0 = cursor.current();
        for (int step = 1; step <= QUADRATIC_STEPS; step++) {
            cursor.emit(quadratic(p0, p1, p2, (double) step / QUADRATIC_STEPS));
        }
        cursor.setControlPoint(p1);
        cursor.advanceTo(p2);
    }

    private List<Command> split(String d) {
        var commands = new ArrayList<Command>();
        int start = -1;
        for (int i = 0; i < d.length(); i++) {
            var c = d.charAt(i);
            if (COMMANDS.indexOf(c) >= 0) {
                if (start >= 0) {
                    commands.add(command(d, start, i));
                } else if (i > 0 && !d.substring(0, i).isBlank()) {
                    log.debug("Skipping data before first path command: '{}'", d.substring(0, i).trim());
                }
                start = i;
            }
        }
        if (start >= 0) {
            commands.add(command(d, start, d.length()));
        }
        return commands;
    }

    private Command command(String d, int start, int end) {
        var letter = d.charAt(start);
        return new Command(letter, Character.isLowerCase(letter), numbers(d.substring(start + 1, end), letter));
    }

    private record Command(char letter, boolean relative, double[] args) {
    }
}
