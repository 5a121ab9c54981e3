package net.moznion.schedsync.config;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import net.moznion.schedsync.JobDefinition;
import net.moznion.schedsync.JobSet;
import net.moznion.schedsync.UserIds;
import net.moznion.schedsync.UserProfile;
import net.moznion.schedsync.exception.InvalidJobSetException;
import net.moznion.schedsync.exception.InvalidUserIdException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads job definitions from a JSON or YAML array file and user profiles from a directory holding
 * one {@code <userId>.json}, {@code <userId>.yml} or {@code <userId>.yaml} per user. Files whose name
 * starts with {@code _} (templates) are skipped. The format is picked by file extension; anything
 * other than {@code .yml}/{@code .yaml} is read as JSON.
 */
@Slf4j
public class JobSetLoader {
    private static final String PROFILE_GLOB = "*.{json,yml,yaml}";
    private static final String SKIPPED_PREFIX = "_";

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public JobSetLoader() {
        this(new ObjectMapper(), new YAMLMapper());
    }

    public JobSetLoader(final ObjectMapper jsonMapper, final ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
    }

    public JobSet load(final Path jobsFile, final Path usersDir) throws IOException, InvalidJobSetException {
        final List<JobDefinition> jobs = loadJobs(jobsFile);
        final Map<String, UserProfile> users = loadUsers(usersDir);
        log.info("Loaded job set [jobs={}, users={}, jobsFile={}, usersDir={}]",
                 jobs.size(), users.size(), jobsFile, usersDir);
        return new JobSet(jobs, users);
    }

    public List<JobDefinition> loadJobs(final Path jobsFile) throws IOException, InvalidJobSetException {
        final List<JobDefinition> jobs =
                mapperFor(jobsFile).readValue(jobsFile.toFile(), new TypeReference<List<JobDefinition>>() {});
        if (jobs == null) {
            throw new InvalidJobSetException("Jobs file holds no job list", jobsFile);
        }

        final Set<String> names = new HashSet<>();
        for (final JobDefinition job : jobs) {
            if (job == null || job.getName() == null) {
                throw new InvalidJobSetException("Job definition without name", jobsFile);
            }
            if (!names.add(job.getName())) {
                throw new InvalidJobSetException("Duplicated job name: " + job.getName(), jobsFile);
            }
            if (!job.getKnownType().isPresent()) {
                log.warn("Unknown job type, passing it through [job={}, type={}]", job.getName(), job.getType());
            }
        }
        return jobs;
    }

    public Map<String, UserProfile> loadUsers(final Path usersDir) throws IOException, InvalidJobSetException {
        final TreeMap<String, UserProfile> users = new TreeMap<>();
        if (usersDir == null || !Files.isDirectory(usersDir)) {
            log.info("No users directory, every job runs single-instance only [usersDir={}]", usersDir);
            return users;
        }

        try (final DirectoryStream<Path> profiles = Files.newDirectoryStream(usersDir, PROFILE_GLOB)) {
            for (final Path profile : profiles) {
                final String fileName = profile.getFileName().toString();
                if (fileName.startsWith(SKIPPED_PREFIX)) {
                    continue;
                }

                final String userId = fileName.substring(0, fileName.lastIndexOf('.'));
                try {
                    UserIds.validate(userId);
                } catch (InvalidUserIdException e) {
                    throw new InvalidJobSetException(e.getMessage(), profile, e);
                }

                if (users.containsKey(userId)) {
                    throw new InvalidJobSetException("Duplicated user profile: " + userId, profile);
                }

                final UserProfile user = mapperFor(profile).readValue(profile.toFile(), UserProfile.class);
                if (user == null) {
                    throw new InvalidJobSetException("Empty user profile", profile);
                }
                if (user.getUserId() != null && !user.getUserId().equals(userId)) {
                    throw new InvalidJobSetException(
                            "user_id " + user.getUserId() + " does not match file name " + fileName, profile);
                }
                users.put(userId, user);
            }
        }
        return users;
    }

    private ObjectMapper mapperFor(final Path file) {
        final String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml") ? yamlMapper : jsonMapper;
    }
}
