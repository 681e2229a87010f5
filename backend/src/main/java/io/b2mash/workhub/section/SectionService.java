package io.b2mash.workhub.section;

import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.project.ProjectAccess;
import io.b2mash.workhub.project.ProjectService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SectionService {

  private static final Logger log = LoggerFactory.getLogger(SectionService.class);

  private final SectionRepository sectionRepository;
  private final ProjectService projectService;

  public SectionService(SectionRepository sectionRepository, ProjectService projectService) {
    this.sectionRepository = sectionRepository;
    this.projectService = projectService;
  }

  /** Creates a section; without an explicit position it goes after the last one. */
  @Transactional
  public Section createSection(Long projectId, String name, Integer position, Principal principal) {
    projectService.requireAccess(projectId, principal);
    int resolvedPosition = position != null ? position : sectionRepository.nextPosition(projectId);
    var section = sectionRepository.save(new Section(projectId, name, resolvedPosition));
    log.info("Created section {} in project {}", section.getId(), projectId);
    return section;
  }

  @Transactional(readOnly = true)
  public List<Section> listSections(Long projectId, Principal principal) {
    projectService.requireAccess(projectId, principal);
    return sectionRepository.findByProjectIdOrderByPositionAscIdAsc(projectId);
  }

  @Transactional(readOnly = true)
  public Section getSection(Long sectionId, Principal principal) {
    return requireSection(sectionId, principal);
  }

  @Transactional
  public Section updateSection(Long sectionId, String name, Integer position, Principal principal) {
    var section = requireSection(sectionId, principal);
    section.update(
        name != null ? name : section.getName(),
        position != null ? position : section.getPosition());
    log.info("Updated section {}", sectionId);
    return section;
  }

  /** Deletes the section. Its tasks stay in the project without a section. */
  @Transactional
  public void deleteSection(Long sectionId, Principal principal) {
    var section = requireSection(sectionId, principal);
    sectionRepository.delete(section);
    log.info("Deleted section {} from project {}", sectionId, section.getProjectId());
  }

  /** Rejects a section reference that does not exist or lives in another project. */
  @Transactional(readOnly = true)
  public void requireSectionInProject(Long sectionId, ProjectAccess access) {
    boolean sameProject =
        sectionRepository
            .findById(sectionId)
            .map(section -> section.getProjectId().equals(access.projectId()))
            .orElse(false);
    if (!sameProject) {
      throw new ValidationException(
          "Invalid section",
          "Section " + sectionId + " does not belong to project " + access.projectId());
    }
  }

  private Section requireSection(Long sectionId, Principal principal) {
    var section =
        sectionRepository
            .findById(sectionId)
            .orElseThrow(() -> new ResourceNotFoundException("Section", sectionId));
    projectService.requireAccess(section.getProjectId(), principal);
    return section;
  }
}
