package tw.gc.stock.crawler.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.stock.crawler.entities.JobExecution;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface JobExecutionRepository extends JpaRepository<JobExecution, Long> {

    Optional<JobExecution> findByJobNameAndBusinessDate(String jobName, LocalDate businessDate);

    List<JobExecution> findTop30ByJobNameOrderByBusinessDateDesc(String jobName);
}
