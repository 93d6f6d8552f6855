/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.dialcodes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.CharSource;
import com.google.common.io.Resources;
import com.ibm.icu.util.Region;
import com.ibm.icu.util.Region.RegionType;
import java.io.IOException;
import java.net.URL;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.goui.smsverify.DialCode;
import net.goui.smsverify.DialCodeLookup;
import net.goui.smsverify.InvalidNumberException;

/**
 * An explicit country to dial code table, typically loaded from a CSV class resource. The
 * expected format is a header line {@code alpha2,dial_code} followed by one row per country:
 *
 * <pre>{@code
 * alpha2,dial_code
 * # Comments and blank lines are ignored.
 * GB,44
 * UA,380
 * }</pre>
 *
 * <p>Several countries may share a dial code (e.g. {@code US} and {@code CA}), but each country
 * may appear only once.
 */
public final class DialCodeTable implements DialCodeLookup {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The name of the bundled table, relative to this class. */
  public static final String DEFAULT_RESOURCE = "dial_codes.csv";

  private static final String HEADER = "alpha2,dial_code";
  private static final Splitter CSV_SPLITTER = Splitter.on(',').trimResults();

  /** Loads the table bundled with this library. */
  public static DialCodeTable loadDefault() throws IOException {
    return load(DialCodeTable.class, DEFAULT_RESOURCE);
  }

  /**
   * Loads a table from a class resource.
   *
   * @param anchor the class against which the resource name is resolved.
   * @param resourceName the name/path of the CSV resource.
   * @throws IOException if the resource cannot be read or its contents are invalid.
   */
  public static DialCodeTable load(Class<?> anchor, String resourceName) throws IOException {
    URL url;
    try {
      url = Resources.getResource(anchor, resourceName);
    } catch (IllegalArgumentException e) {
      throw new IOException("no such resource: " + resourceName, e);
    }
    try {
      DialCodeTable table = parse(Resources.asCharSource(url, UTF_8));
      logger.atInfo().log("Loaded %d dial codes from: %s", table.size(), url);
      return table;
    } catch (IllegalArgumentException e) {
      throw new IOException("error loading resource: " + resourceName, e);
    }
  }

  /**
   * Parses a table from CSV text.
   *
   * @throws IllegalArgumentException if the text is not a valid table (with the failing line).
   */
  public static DialCodeTable parse(CharSource csv) throws IOException {
    ImmutableMap.Builder<Region, DialCode> codes = ImmutableMap.builder();
    boolean seenHeader = false;
    int lineNumber = 0;
    for (String line : csv.readLines()) {
      lineNumber++;
      line = line.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      if (!seenHeader) {
        checkArgument(line.equals(HEADER), "line %s: expected header '%s'", lineNumber, HEADER);
        seenHeader = true;
        continue;
      }
      List<String> columns = CSV_SPLITTER.splitToList(line);
      checkArgument(columns.size() == 2, "line %s: expected 2 columns: %s", lineNumber, line);
      codes.put(
          parseCountry(columns.get(0), lineNumber), parseDialCode(columns.get(1), lineNumber));
    }
    checkArgument(seenHeader, "missing header '%s'", HEADER);
    try {
      return new DialCodeTable(codes.buildOrThrow());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("duplicate country in dial code table", e);
    }
  }

  /** Returns a table with the given entries. */
  public static DialCodeTable of(Map<Region, DialCode> codes) {
    codes.keySet().forEach(DialCodeTable::checkTerritory);
    return new DialCodeTable(ImmutableMap.copyOf(codes));
  }

  private static Region parseCountry(String alpha2, int lineNumber) {
    checkArgument(
        alpha2.length() == 2,
        "line %s: expected a two-letter country code: %s",
        lineNumber,
        alpha2);
    Region region;
    try {
      region = Region.getInstance(alpha2);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("line " + lineNumber + ": unknown country: " + alpha2, e);
    }
    checkArgument(
        region.getType() == RegionType.TERRITORY,
        "line %s: not a country: %s (%s)",
        lineNumber,
        alpha2,
        region.getType());
    return region;
  }

  private static DialCode parseDialCode(String digits, int lineNumber) {
    try {
      return DialCode.parse(digits);
    } catch (InvalidNumberException e) {
      throw new IllegalArgumentException("line " + lineNumber + ": " + e.getMessage(), e);
    }
  }

  private static void checkTerritory(Region country) {
    checkArgument(
        country.getType() == RegionType.TERRITORY,
        "not a country: %s (%s)",
        country,
        country.getType());
  }

  private final ImmutableMap<Region, DialCode> codes;

  private DialCodeTable(ImmutableMap<Region, DialCode> codes) {
    this.codes = checkNotNull(codes);
  }

  @Override
  public Optional<DialCode> dialCodeFor(Region country) {
    return Optional.ofNullable(codes.get(country));
  }

  @Override
  public ImmutableSet<Region> supportedCountries() {
    return codes.keySet();
  }

  /** Returns the countries sharing each dial code in this table. */
  public ImmutableSetMultimap<DialCode, Region> countriesByDialCode() {
    return codes.entrySet().stream()
        .collect(
            ImmutableSetMultimap.toImmutableSetMultimap(Map.Entry::getValue, Map.Entry::getKey));
  }

  public int size() {
    return codes.size();
  }

  @Override
  public String toString() {
    return "DialCodeTable{" + codes.size() + " countries}";
  }
}
