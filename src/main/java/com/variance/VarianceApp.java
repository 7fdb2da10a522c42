package com.variance;

import com.variance.io.JsonFileRepository;
import com.variance.io.ReadOnlyRepository;
import com.variance.io.Repository;
import com.variance.io.RepositoryException;
import com.variance.io.StoreConfig;
import com.variance.io.WriteOnlyRepository;
import com.variance.model.Employee;
import com.variance.model.Person;
import com.variance.model.RemoteEmployee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Demonstrates read/write capability variance on a file-backed employee store.
 *
 * Usage: VarianceApp [dataDir]
 */
public class VarianceApp {

    private static final Logger log = LoggerFactory.getLogger(VarianceApp.class);

    public static void main(String[] args) {
        try {
            Repository<Employee> employees = args.length > 0
                ? new JsonFileRepository<>(Employee.class, StoreConfig.fromSystemProperties().withRootDirectory(Path.of(args[0])))
                : new JsonFileRepository<>(Employee.class);
            run(employees, System.out);
        } catch (RepositoryException e) {
            log.error("Store operation failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(Repository<Employee> employees, PrintStream out) {
        addEmployees(employees);
        addRemoteEmployees(employees);
        printRepository(employees, out);
    }

    /**
     * Karen is inserted twice; the plain Employee written last is the one kept.
     */
    static void addEmployees(WriteOnlyRepository<? super Employee> repository) {
        List.of(
            new RemoteEmployee("Karen", "Usa"),
            new Employee("Karen")
        ).forEach(repository::insert);
    }

    /**
     * Only needs to put remote employees somewhere, so any writer of a supertype will do.
     */
    static void addRemoteEmployees(WriteOnlyRepository<? super RemoteEmployee> repository) {
        WriteOnlyRepository<RemoteEmployee> remote = WriteOnlyRepository.narrow(repository);
        remote.insert(new RemoteEmployee("Andrew", "Canada"));
        remote.insert(new RemoteEmployee("Carol", "UK"));
    }

    static void printRepository(ReadOnlyRepository<? extends Person> repository, PrintStream out) {
        ReadOnlyRepository<Person> people = ReadOnlyRepository.widen(repository);
        try (Stream<Person> all = people.getAll()) {
            all.forEach(out::println);
        }
    }
}
