package com.verlumen.evolve.training;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.primitives.ImmutableDoubleArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.verlumen.evolve.benchmark.BenchmarkModule;
import com.verlumen.evolve.engine.Chromosome;
import com.verlumen.evolve.engine.EvolutionConstants;
import com.verlumen.evolve.engine.TrainingOptions;
import com.verlumen.evolve.engine.Verbosity;
import com.verlumen.evolve.persistence.PopulationStore;
import com.verlumen.evolve.selection.RouletteSelection.DegenerateWeightPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Optional;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AppTest {
  private static final ImmutableDoubleArray TARGET = ImmutableDoubleArray.of(1, 2);

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private static Namespace parse(String... args) throws ArgumentParserException {
    return App.createParser().parseArgs(args);
  }

  private static App createApp(long seed) {
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(6)
            .setGeneCount(TARGET.length())
            .setWorkerCount(2)
            .setSeed(seed)
            .setVerbosity(Verbosity.QUIET)
            .build();
    return Guice.createInjector(
            EvolutionModule.create(config), BenchmarkModule.create(TARGET, 0, 1))
        .getInstance(App.class);
  }

  @Test
  public void parser_onlyTarget_usesDefaults() throws Exception {
    // Act
    Namespace namespace = parse("--target", "1,2,3");
    EvolutionConfig config = App.toEvolutionConfig(namespace, 3);
    TrainingOptions options = App.toTrainingOptions(namespace, Optional.empty());

    // Assert
    assertThat(config.populationSize()).isEqualTo(EvolutionConstants.DEFAULT_POPULATION_SIZE);
    assertThat(config.geneCount()).isEqualTo(3);
    assertThat(config.selectionType()).isEqualTo(SelectionType.ROULETTE);
    assertThat(config.crossoverType()).isEqualTo(CrossoverType.UNIFORM);
    assertThat(config.mutationType()).isEqualTo(MutationType.NOISY);
    assertThat(config.verbosity()).isEqualTo(Verbosity.SUMMARY);
    assertThat(config.seed()).isEmpty();
    assertThat(config.workerCount()).isEqualTo(Runtime.getRuntime().availableProcessors());
    assertThat(options.isUnbounded()).isTrue();
    assertThat(options.elitismFraction())
        .isEqualTo(EvolutionConstants.DEFAULT_ELITISM_FRACTION);
    assertThat(options.stoppingThreshold())
        .isEqualTo(EvolutionConstants.DEFAULT_STOPPING_THRESHOLD);
    assertThat(options.savePath()).isEmpty();
  }

  @Test
  public void parser_strategyFlags_mapToConfig() throws Exception {
    Namespace namespace =
        parse(
            "--target", "0,0,0,0",
            "--selection", "tournament",
            "--tournamentSize", "5",
            "--crossover", "k_point",
            "--crossoverPoints", "3",
            "--mutation", "swap",
            "--mutationRate", "0.2",
            "--degenerateWeights", "uniform",
            "--seed", "99",
            "--workers", "3",
            "--verbosity", "2");

    EvolutionConfig config = App.toEvolutionConfig(namespace, 4);

    assertThat(config.selectionType()).isEqualTo(SelectionType.TOURNAMENT);
    assertThat(config.tournamentSize()).isEqualTo(5);
    assertThat(config.crossoverType()).isEqualTo(CrossoverType.K_POINT);
    assertThat(config.crossoverPoints()).isEqualTo(3);
    assertThat(config.mutationType()).isEqualTo(MutationType.SWAP);
    assertThat(config.mutationRate()).isEqualTo(0.2);
    assertThat(config.degenerateWeightPolicy()).isEqualTo(DegenerateWeightPolicy.UNIFORM);
    assertThat(config.seed()).hasValue(99L);
    assertThat(config.workerCount()).isEqualTo(3);
    assertThat(config.verbosity()).isEqualTo(Verbosity.DETAILED);
  }

  @Test
  public void parser_trainingFlags_mapToOptions() throws Exception {
    Path savePath = temporaryFolder.getRoot().toPath().resolve("population.json");
    Namespace namespace =
        parse("--target", "1", "--cycles", "25", "--elitism", "0.3", "--stoppingThreshold", "0");

    TrainingOptions options = App.toTrainingOptions(namespace, Optional.of(savePath));

    assertThat(options.cycleBudget()).isEqualTo(25);
    assertThat(options.elitismFraction()).isEqualTo(0.3);
    assertThat(options.stoppingThreshold()).isEqualTo(0.0);
    assertThat(options.savePath()).hasValue(savePath);
  }

  @Test
  public void parser_missingTarget_throwsException() {
    assertThrows(ArgumentParserException.class, () -> parse("--cycles", "3"));
  }

  @Test
  public void parser_unknownSelection_throwsException() {
    assertThrows(
        ArgumentParserException.class, () -> parse("--target", "1", "--selection", "lottery"));
  }

  @Test
  public void parseTarget_trimsAndSkipsEmptyValues() {
    assertThat(App.parseTarget(" 1.5, -2 ,,3 ")).isEqualTo(ImmutableDoubleArray.of(1.5, -2, 3));
  }

  @Test
  public void parseTarget_empty_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> App.parseTarget(" , "));
  }

  @Test
  public void parseTarget_notANumber_throwsException() {
    assertThrows(NumberFormatException.class, () -> App.parseTarget("1,x"));
  }

  @Test
  public void run_writesPopulationAndBestFiles() throws Exception {
    // Arrange
    Path populationFile = temporaryFolder.getRoot().toPath().resolve("population.json");
    Path bestFile = temporaryFolder.getRoot().toPath().resolve("best.json");
    TrainingOptions options =
        TrainingOptions.builder()
            .setCycleBudget(3)
            .setElitismFraction(0.2)
            .setSavePath(populationFile)
            .build();

    // Act
    Chromosome best =
        createApp(5).run(options, Optional.of(populationFile), Optional.of(bestFile));

    // Assert
    assertThat(new PopulationStore().load(populationFile)).hasSize(6);
    JsonObject document =
        JsonParser.parseString(Files.readString(bestFile, UTF_8)).getAsJsonObject();
    assertThat(document.get("fitness").getAsDouble()).isEqualTo(best.fitness());
    assertThat(document.getAsJsonArray("genes").size()).isEqualTo(2);
  }

  @Test
  public void run_existingPopulationFile_resumesFromSavedGenes() throws Exception {
    // Arrange
    Path populationFile = temporaryFolder.getRoot().toPath().resolve("population.json");
    new PopulationStore().save(populationFile, Collections.nCopies(6, TARGET));
    TrainingOptions options = TrainingOptions.builder().setCycleBudget(0).build();

    // Act
    Chromosome best = createApp(11).run(options, Optional.of(populationFile), Optional.empty());

    // Assert
    assertThat(best.genes()).isEqualTo(TARGET);
    assertThat(best.fitness()).isEqualTo(1.0);
  }
}
