package com.bsk.recommender.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.bsk.recommender.config.ApplicationProperties;
import com.bsk.recommender.exception.ReferenceDataException;
import com.bsk.recommender.service.catalog.ServiceCatalog;
import com.bsk.recommender.service.catalog.ServiceOffering;
import com.bsk.recommender.service.citizen.CitizenDirectory;
import com.bsk.recommender.service.citizen.CitizenRow;
import com.bsk.recommender.service.demographic.AgeBand;
import com.bsk.recommender.service.demographic.ClusterSignature;
import com.bsk.recommender.service.demographic.DemographicClusterMap;
import com.bsk.recommender.service.district.District;
import com.bsk.recommender.service.district.DistrictRanker;
import com.bsk.recommender.service.similarity.ContentSimilarityIndex;
import com.bsk.recommender.service.similarity.SimilarNeighbour;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the reference tables once at start-up and builds the lookup structures from them.
 *
 * <p>The catalog has to be loaded first: every other table is checked against it here, and
 * references that do not resolve are dropped with a single warning per offending id, so nothing
 * unresolved reaches request time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceDataLoader {

  private static final String[] PHONE_COLUMNS = {"citizen_phone", "phone", "mobile"};
  private static final String[] DOMAIN_COLUMNS = {"domain", "service_domain", "category"};

  private final ResourceLoader resourceLoader;
  private final CsvParsingService csvParsingService;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  private final ReferenceIntegrityLog integrityLog = new ReferenceIntegrityLog();

  public ServiceCatalog loadServiceCatalog() {
    ApplicationProperties.DataFiles files = properties.getData();
    CsvTable table = readRequiredCsv(files.getServicesFile(), files.getServicesEncoding());
    requireColumns(table, "service_id", "service_name");
    Optional<String> domainColumn = table.firstPresentColumn(DOMAIN_COLUMNS);

    List<ServiceOffering> services = new ArrayList<>();
    for (Map<String, String> row : table.getRows()) {
      Optional<Integer> id = CsvParsingService.parseInteger(row.get("service_id"));
      String name = row.get("service_name");
      if (id.isEmpty() || name == null || name.isBlank()) {
        log.warn("Skipping catalog row without a usable id or name: {}", row);
        continue;
      }
      services.add(
          ServiceOffering.builder()
              .id(id.get())
              .name(name)
              .domain(domainColumn.map(row::get).orElse(""))
              .build());
    }

    ApplicationProperties.Policy policy = properties.getPolicy();
    return new ServiceCatalog(
        services, policy.getExcludedKeywords(), policy.getCasteTargetedKeywords());
  }

  public DistrictRanker loadDistrictRanker(ServiceCatalog catalog) {
    String file = properties.getData().getDistrictRankingFile();
    CsvTable table = readRequiredCsv(file, properties.getData().getEncoding());
    requireColumns(table, "district_id");
    boolean byId = table.hasColumn("service_id");
    if (!byId && !table.hasColumn("service_name")) {
      throw new ReferenceDataException(file + " needs a service_id or service_name column");
    }

    Map<Integer, String> names = new LinkedHashMap<>();
    Map<Integer, List<RankedEntry>> entries = new LinkedHashMap<>();
    int order = 0;
    for (Map<String, String> row : table.getRows()) {
      Optional<Integer> districtId = CsvParsingService.parseInteger(row.get("district_id"));
      if (districtId.isEmpty()) {
        log.warn("Skipping {} row without a district id: {}", file, row);
        continue;
      }
      names.putIfAbsent(districtId.get(), row.getOrDefault("district_name", ""));
      Optional<Integer> serviceId =
          byId
              ? resolveServiceId(file, row.get("service_id"), catalog)
              : resolveServiceName(file, row.get("service_name"), catalog);
      int rank =
          CsvParsingService.parseInteger(row.get("rank")).orElse(Integer.MAX_VALUE);
      int position = order++;
      serviceId.ifPresent(
          id ->
              entries
                  .computeIfAbsent(districtId.get(), key -> new ArrayList<>())
                  .add(new RankedEntry(id, rank, position)));
    }

    List<District> districts = new ArrayList<>();
    names.forEach(
        (districtId, name) -> {
          Set<Integer> ranking = new LinkedHashSet<>();
          entries.getOrDefault(districtId, List.of()).stream()
              .sorted(
                  Comparator.comparingInt(RankedEntry::rank)
                      .thenComparingInt(RankedEntry::position))
              .forEach(entry -> ranking.add(entry.serviceId()));
          districts.add(new District(districtId, name, new ArrayList<>(ranking)));
        });

    return new DistrictRanker(catalog, districts, properties.getRanking().getDistrictTopN());
  }

  public DemographicClusterMap loadDemographicClusterMap(ServiceCatalog catalog) {
    String file = properties.getData().getClusterMapFile();
    ClusterMapArtifact artifact;
    try (InputStream in = openRequired(file)) {
      artifact = objectMapper.readValue(in, ClusterMapArtifact.class);
    } catch (IOException e) {
      throw new ReferenceDataException("Failed to read cluster map " + file, e);
    }

    Map<Integer, List<Integer>> rankings = new HashMap<>();
    if (artifact.getClusters() != null) {
      artifact
          .getClusters()
          .forEach(
              (key, serviceIds) -> {
                Optional<Integer> clusterId = CsvParsingService.parseInteger(key);
                if (clusterId.isEmpty()) {
                  log.warn("Ignoring cluster with non-numeric id '{}' in {}", key, file);
                  return;
                }
                Set<Integer> ranking = new LinkedHashSet<>();
                for (Integer serviceId : serviceIds == null ? List.<Integer>of() : serviceIds) {
                  if (serviceId == null) {
                    continue;
                  }
                  if (catalog.isResolvable(serviceId)) {
                    ranking.add(serviceId);
                  } else {
                    integrityLog.unresolvedServiceId(file, serviceId);
                  }
                }
                rankings.put(clusterId.get(), new ArrayList<>(ranking));
              });
    }

    Map<ClusterSignature, Integer> signatures = new HashMap<>();
    int skipped = 0;
    for (ClusterMapArtifact.SignatureEntry entry :
        artifact.getSignatures() == null
            ? List.<ClusterMapArtifact.SignatureEntry>of()
            : artifact.getSignatures()) {
      Optional<AgeBand> ageBand = AgeBand.fromLabel(entry.getAgeGroup());
      if (entry.getDistrictId() == null || entry.getClusterId() == null || ageBand.isEmpty()) {
        log.warn("Skipping incomplete signature in {}: {}", file, entry);
        skipped++;
        continue;
      }
      if (!rankings.containsKey(entry.getClusterId())) {
        log.warn(
            "Signature {} points at cluster {} which has no ranking in {}",
            entry,
            entry.getClusterId(),
            file);
        skipped++;
        continue;
      }
      ClusterSignature signature =
          ClusterSignature.of(
              entry.getDistrictId(),
              entry.getGender(),
              entry.getCaste(),
              ageBand.get(),
              entry.getReligionGroup());
      Integer previous = signatures.putIfAbsent(signature, entry.getClusterId());
      if (previous != null && !previous.equals(entry.getClusterId())) {
        log.warn(
            "Signature {} is mapped to clusters {} and {}, keeping {}",
            signature,
            previous,
            entry.getClusterId(),
            previous);
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} signatures of cluster map {}", skipped, file);
    }
    log.info("Loaded cluster map version {} from {}", artifact.getVersion(), file);

    return new DemographicClusterMap(
        catalog,
        signatures,
        rankings,
        properties.getPolicy().getGeneralCaste(),
        properties.getRanking().getDemographicTopN());
  }

  /**
   * Loads the square similarity matrix. The header row lists service ids, the first column of each
   * row is the anchor service id.
   */
  public ContentSimilarityIndex loadContentSimilarityIndex(ServiceCatalog catalog) {
    String file = properties.getData().getSimilarityMatrixFile();
    CsvTable table = readRequiredCsv(file, properties.getData().getEncoding());
    List<String> columns = table.getColumns();
    if (columns.size() < 2) {
      throw new ReferenceDataException(file + " is not a similarity matrix");
    }
    String anchorColumn = columns.get(0);

    Map<String, Integer> neighbourColumns = new LinkedHashMap<>();
    for (String column : columns.subList(1, columns.size())) {
      Optional<Integer> serviceId = CsvParsingService.parseInteger(column);
      if (serviceId.isEmpty()) {
        log.warn("Ignoring similarity column '{}' without a service id", column);
      } else if (!catalog.isResolvable(serviceId.get())) {
        integrityLog.unresolvedServiceId(file, serviceId.get());
      } else if (!catalog.isExcludedCategory(serviceId.get())) {
        neighbourColumns.put(column, serviceId.get());
      }
    }

    Map<Integer, List<SimilarNeighbour>> rows = new HashMap<>();
    for (Map<String, String> row : table.getRows()) {
      Optional<Integer> anchorId = CsvParsingService.parseInteger(row.get(anchorColumn));
      if (anchorId.isEmpty()) {
        log.warn("Skipping similarity row without an anchor id");
        continue;
      }
      if (!catalog.isResolvable(anchorId.get())) {
        integrityLog.unresolvedServiceId(file, anchorId.get());
        continue;
      }
      List<SimilarNeighbour> neighbours = new ArrayList<>();
      neighbourColumns.forEach(
          (column, serviceId) -> {
            if (serviceId.equals(anchorId.get())) {
              return;
            }
            CsvParsingService.parseDouble(row.get(column))
                .ifPresent(score -> neighbours.add(new SimilarNeighbour(serviceId, score)));
          });
      rows.put(anchorId.get(), neighbours);
    }

    ApplicationProperties.Ranking ranking = properties.getRanking();
    return new ContentSimilarityIndex(
        catalog, rows, ranking.getStoredNeighbours(), ranking.getContentTopK());
  }

  /**
   * Loads citizens and their provision history. Both files are optional in a deployment: without
   * the master file phone search is disabled, without the provision log histories are empty.
   */
  public CitizenDirectory loadCitizenDirectory(ServiceCatalog catalog) {
    ApplicationProperties.DataFiles files = properties.getData();
    Optional<CsvTable> master =
        readOptionalCsv(files.getCitizensFile(), files.getCitizensEncoding());
    if (master.isEmpty()) {
      log.warn("{} not found, phone search disabled", files.getCitizensFile());
      return CitizenDirectory.unavailable(catalog);
    }
    CsvTable table = master.get();
    requireColumns(table, "citizen_id");
    Optional<String> phoneColumn = table.firstPresentColumn(PHONE_COLUMNS);
    if (phoneColumn.isEmpty()) {
      log.warn("No phone number column in {}, phone search will find nobody", table.getName());
    }
    Optional<String> nameColumn = table.firstPresentColumn("citizen_name", "name");

    List<CitizenRow> rows = new ArrayList<>();
    for (Map<String, String> row : table.getRows()) {
      rows.add(
          CitizenRow.builder()
              .citizenId(row.get("citizen_id"))
              .phone(phoneColumn.map(row::get).orElse(null))
              .name(nameColumn.map(row::get).orElse(null))
              .gender(row.get("gender"))
              .caste(row.get("caste"))
              .religion(row.get("religion"))
              .age(CsvParsingService.parseInteger(row.get("age")).orElse(null))
              .districtId(CsvParsingService.parseInteger(row.get("district_id")).orElse(null))
              .build());
    }

    ApplicationProperties.Policy policy = properties.getPolicy();
    return new CitizenDirectory(
        catalog,
        rows,
        loadUsageCounts(catalog),
        policy.getMaskToken(),
        policy.getBlankNameToken());
  }

  /**
   * Services open to under-18 citizens. The list may carry ids, names, or both; names are matched
   * against the catalog after normalisation.
   */
  public Set<Integer> loadMinorEligibleServices(ServiceCatalog catalog) {
    String file = properties.getData().getMinorEligibleServicesFile();
    Optional<CsvTable> table = readOptionalCsv(file, properties.getData().getEncoding());
    if (table.isEmpty()) {
      log.info("{} not found, no under-18 eligibility list", file);
      return Set.of();
    }

    Set<Integer> eligible = new LinkedHashSet<>();
    for (Map<String, String> row : table.get().getRows()) {
      Optional<Integer> serviceId =
          row.containsKey("service_id") && !row.get("service_id").isBlank()
              ? resolveServiceId(file, row.get("service_id"), catalog)
              : resolveServiceName(file, row.get("service_name"), catalog);
      serviceId.ifPresent(eligible::add);
    }
    log.info("Loaded {} under-18 eligible services from {}", eligible.size(), file);
    return eligible;
  }

  public ReferenceIntegrityLog getIntegrityLog() {
    return integrityLog;
  }

  private Map<String, Map<Integer, Integer>> loadUsageCounts(ServiceCatalog catalog) {
    String file = properties.getData().getProvisionFile();
    Optional<CsvTable> provisions =
        readOptionalCsv(file, properties.getData().getProvisionEncoding());
    if (provisions.isEmpty()) {
      log.warn("{} not found, service history disabled", file);
      return Map.of();
    }
    CsvTable table = provisions.get();
    Optional<String> citizenColumn = table.firstPresentColumn("customer_id", "citizen_id");
    if (citizenColumn.isEmpty() || !table.hasColumn("service_id")) {
      throw new ReferenceDataException(
          file + " needs a customer_id (or citizen_id) and a service_id column");
    }

    Map<String, Map<Integer, Integer>> counts = new HashMap<>();
    for (Map<String, String> row : table.getRows()) {
      String citizenId = row.get(citizenColumn.get());
      if (citizenId == null || citizenId.isBlank()) {
        continue;
      }
      resolveServiceId(file, row.get("service_id"), catalog)
          .ifPresent(
              serviceId ->
                  counts
                      .computeIfAbsent(citizenId.trim(), key -> new HashMap<>())
                      .merge(serviceId, 1, Integer::sum));
    }
    return counts;
  }

  private Optional<Integer> resolveServiceId(String table, String value, ServiceCatalog catalog) {
    Optional<Integer> serviceId = CsvParsingService.parseInteger(value);
    if (serviceId.isEmpty()) {
      log.debug("Ignoring non-numeric service id '{}' in {}", value, table);
      return Optional.empty();
    }
    if (!catalog.isResolvable(serviceId.get())) {
      integrityLog.unresolvedServiceId(table, serviceId.get());
      return Optional.empty();
    }
    return serviceId;
  }

  private Optional<Integer> resolveServiceName(String table, String name, ServiceCatalog catalog) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    Optional<ServiceOffering> service = catalog.findByNormalizedName(name);
    if (service.isEmpty()) {
      integrityLog.unresolvedServiceName(table, name);
    }
    return service.map(ServiceOffering::getId);
  }

  private CsvTable readRequiredCsv(String file, String encoding) {
    try (InputStream in = openRequired(file)) {
      return csvParsingService.parse(in, file, Charset.forName(encoding));
    } catch (IOException | IllegalArgumentException e) {
      throw new ReferenceDataException("Failed to read reference table " + file, e);
    }
  }

  private Optional<CsvTable> readOptionalCsv(String file, String encoding) {
    Resource resource = resolve(file);
    if (!resource.exists()) {
      return Optional.empty();
    }
    try (InputStream in = resource.getInputStream()) {
      return Optional.of(csvParsingService.parse(in, file, Charset.forName(encoding)));
    } catch (IOException | IllegalArgumentException e) {
      throw new ReferenceDataException("Failed to read reference table " + file, e);
    }
  }

  private InputStream openRequired(String file) throws IOException {
    Resource resource = resolve(file);
    if (!resource.exists()) {
      throw new ReferenceDataException(
          "Required reference table "
              + file
              + " not found at "
              + properties.getData().getLocation());
    }
    return resource.getInputStream();
  }

  private Resource resolve(String file) {
    String location = properties.getData().getLocation();
    String separator = location.endsWith("/") ? "" : "/";
    return resourceLoader.getResource(location + separator + file);
  }

  private static void requireColumns(CsvTable table, String... columns) {
    for (String column : columns) {
      if (!table.hasColumn(column)) {
        throw new ReferenceDataException(
            table.getName() + " is missing column '" + column + "', found " + table.getColumns());
      }
    }
  }

  private static final class RankedEntry {
    private final int serviceId;
    private final int rank;
    private final int position;

    private RankedEntry(int serviceId, int rank, int position) {
      this.serviceId = serviceId;
      this.rank = rank;
      this.position = position;
    }

    int serviceId() {
      return serviceId;
    }

    int rank() {
      return rank;
    }

    int position() {
      return position;
    }
  }
}
