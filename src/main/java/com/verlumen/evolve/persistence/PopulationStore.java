package com.verlumen.evolve.persistence;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes gene vectors as JSON.
 *
 * <p>A population document maps each chromosome's index, as a string key, to its gene array:
 *
 * <pre>{"0": [1.5, -0.25], "1": [0.75, 3.0]}</pre>
 *
 * Writes go to a temporary file next to the target which is then moved into place, so a failed
 * write never leaves a partial document behind.
 */
public final class PopulationStore {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Gson GSON = new Gson();

  @Inject
  public PopulationStore() {}

  /**
   * Writes one gene vector per chromosome, keyed by position.
   *
   * @throws PersistenceException if a gene is not finite or the file cannot be written
   */
  public void save(Path path, List<ImmutableDoubleArray> population) {
    JsonObject document = new JsonObject();
    for (int i = 0; i < population.size(); i++) {
      document.add(Integer.toString(i), toJsonArray(population.get(i), i));
    }
    write(path, document);
    logger.atInfo().log("Saved %d chromosomes to %s", population.size(), path);
  }

  /**
   * Reads a population document, returning gene vectors ordered by index.
   *
   * @throws PersistenceException if the file cannot be read, is malformed, or its keys are not
   *     exactly {@code 0..n-1}
   */
  public ImmutableList<ImmutableDoubleArray> load(Path path) {
    JsonObject document = read(path);
    int size = document.size();
    ImmutableDoubleArray[] population = new ImmutableDoubleArray[size];
    for (Map.Entry<String, JsonElement> entry : document.entrySet()) {
      int index = parseIndex(entry.getKey(), size, path);
      if (population[index] != null) {
        throw new PersistenceException("Duplicate chromosome index " + index + " in " + path);
      }
      population[index] = toGenes(entry.getValue(), index, path);
    }
    logger.atInfo().log("Loaded %d chromosomes from %s", size, path);
    return ImmutableList.copyOf(population);
  }

  /**
   * Writes a single chromosome as {@code {"fitness": f, "genes": [...]}}.
   *
   * @throws PersistenceException if a value is not finite or the file cannot be written
   */
  public void saveBest(Path path, ImmutableDoubleArray genes, double fitness) {
    if (!Double.isFinite(fitness)) {
      throw new PersistenceException("Fitness is not a finite number: " + fitness);
    }
    JsonObject document = new JsonObject();
    document.addProperty("fitness", fitness);
    document.add("genes", toJsonArray(genes, 0));
    write(path, document);
  }

  private static JsonArray toJsonArray(ImmutableDoubleArray genes, int index) {
    JsonArray array = new JsonArray(genes.length());
    for (int position = 0; position < genes.length(); position++) {
      double gene = genes.get(position);
      if (!Double.isFinite(gene)) {
        throw new PersistenceException(
            String.format(
                "Gene %d of chromosome %d is not a finite number: %s", position, index, gene));
      }
      array.add(gene);
    }
    return array;
  }

  private static void write(Path path, JsonObject document) {
    Path absolute = path.toAbsolutePath();
    Path temporary = null;
    try {
      temporary =
          Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
      try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
        GSON.toJson(document, writer);
      }
      Files.move(
          temporary, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException | RuntimeException e) {
      deleteQuietly(temporary);
      throw new PersistenceException("Failed to write " + path, e);
    }
  }

  private static void deleteQuietly(Path temporary) {
    if (temporary == null) {
      return;
    }
    try {
      Files.deleteIfExists(temporary);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Could not delete temporary file %s", temporary);
    }
  }

  private static JsonObject read(Path path) {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      JsonElement root = JsonParser.parseReader(reader);
      if (!root.isJsonObject()) {
        throw new PersistenceException("Expected a JSON object in " + path);
      }
      return root.getAsJsonObject();
    } catch (IOException | JsonParseException e) {
      throw new PersistenceException("Failed to read " + path, e);
    }
  }

  private static int parseIndex(String key, int size, Path path) {
    int index;
    try {
      index = Integer.parseInt(key);
    } catch (NumberFormatException e) {
      throw new PersistenceException("Invalid chromosome index '" + key + "' in " + path, e);
    }
    if (index < 0 || index >= size) {
      throw new PersistenceException(
          "Chromosome index " + index + " out of range [0, " + size + ") in " + path);
    }
    return index;
  }

  private static ImmutableDoubleArray toGenes(JsonElement element, int index, Path path) {
    if (!element.isJsonArray()) {
      throw new PersistenceException("Chromosome " + index + " is not an array in " + path);
    }
    JsonArray array = element.getAsJsonArray();
    ImmutableDoubleArray.Builder genes = ImmutableDoubleArray.builder(array.size());
    for (JsonElement gene : array) {
      try {
        genes.add(gene.getAsDouble());
      } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
        throw new PersistenceException(
            "Chromosome " + index + " has a non-numeric gene in " + path, e);
      }
    }
    return genes.build();
  }
}
