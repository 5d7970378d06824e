package com.jmapmail.service;

import com.jmapmail.config.ServerProperties;
import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.ChangeOp;
import com.jmapmail.domain.JmapType;
import com.jmapmail.domain.Mailbox;
import com.jmapmail.domain.MailboxCounts;
import com.jmapmail.jmap.GetResponse;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapErrorType;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.QueryResponse;
import com.jmapmail.jmap.SetError;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.GetArgs;
import com.jmapmail.jmap.args.MailboxCreate;
import com.jmapmail.jmap.args.MailboxQueryArgs;
import com.jmapmail.jmap.args.MailboxSetArgs;
import com.jmapmail.mapper.AccountMessageMapper;
import com.jmapmail.mapper.MailboxMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Mailbox engine
 * - Mailbox/get with counts, Mailbox/query
 * - Mailbox/set: hierarchy, role and emptiness constraints
 * - Default role mailboxes for new accounts
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxService {

    public static final List<String> COUNT_PROPERTIES =
            List.of("totalEmails", "unreadEmails", "totalThreads", "unreadThreads");

    /**
     * Reserved roles with their default mailbox names, in creation order
     */
    public static final Map<String, String> DEFAULT_ROLES = defaultRoles();

    private static final Set<String> UPDATABLE = Set.of("name", "parentId", "role", "sortOrder", "isSubscribed");

    private final MailboxMapper mailboxMapper;
    private final AccountMessageMapper accountMessageMapper;
    private final MessageCleanupService cleanupService;
    private final ChangeLogService changeLogService;
    private final ServerProperties properties;
    private final Clock clock;

    private static Map<String, String> defaultRoles() {
        Map<String, String> roles = new LinkedHashMap<>();
        roles.put("inbox", "Inbox");
        roles.put("drafts", "Drafts");
        roles.put("sent", "Sent");
        roles.put("archive", "Archive");
        roles.put("trash", "Trash");
        roles.put("spam", "Spam");
        return roles;
    }

    /**
     * Create the role mailboxes of a new account
     */
    @Transactional
    public List<Mailbox> createDefaultMailboxes(String accountId) {
        List<Mailbox> created = new ArrayList<>();
        int sortOrder = 0;
        for (Map.Entry<String, String> role : DEFAULT_ROLES.entrySet()) {
            if (mailboxMapper.findByRole(accountId, role.getKey()) != null) {
                continue;
            }
            Mailbox mailbox = newMailbox(accountId, role.getValue(), null, role.getKey(), sortOrder++, true);
            mailboxMapper.insert(mailbox);
            changeLogService.record(accountId, JmapType.MAILBOX, mailbox.getId(), ChangeOp.CREATE);
            created.add(mailbox);
        }
        log.info("Default mailboxes created for account {}: {}", accountId, created.size());
        return created;
    }

    public Mailbox findByRole(String accountId, String role) {
        return mailboxMapper.findByRole(accountId, role);
    }

    /**
     * Mailbox/get
     */
    public GetResponse get(String accountId, GetArgs args) {
        if (args.getIds() != null && args.getIds().size() > properties.getLimits().getMaxObjectsInGet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many ids, maximum is " + properties.getLimits().getMaxObjectsInGet());
        }
        String state = changeLogService.getState(accountId, JmapType.MAILBOX);

        Map<String, Mailbox> byId = new LinkedHashMap<>();
        for (Mailbox mailbox : mailboxMapper.findByAccount(accountId)) {
            byId.put(mailbox.getId(), mailbox);
        }
        Map<String, MailboxCounts> counts = new HashMap<>();
        for (MailboxCounts count : mailboxMapper.countsByAccount(accountId)) {
            counts.put(count.getMailboxId(), count);
        }

        List<Map<String, Object>> list = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        List<String> ids = args.getIds() == null ? new ArrayList<>(byId.keySet()) : args.getIds();
        for (String id : ids) {
            Mailbox mailbox = byId.get(id);
            if (mailbox == null) {
                notFound.add(id);
                continue;
            }
            list.add(filter(toJmap(mailbox, counts.get(id)), args.getProperties()));
        }
        return new GetResponse(accountId, state, list, notFound);
    }

    /**
     * Mailbox/query over the account's mailboxes.
     * filterAsTree drops a match whose ancestor does not match; sortAsTree lists parents before
     * their children, siblings in comparator order.
     */
    public QueryResponse query(String accountId, MailboxQueryArgs args) {
        if (args.getPosition() < 0) {
            throw JmapException.invalidArguments("position must not be negative");
        }
        int maxLimit = properties.getLimits().getMaxObjectsInGet();
        int limit = args.getLimit() == null ? maxLimit : args.getLimit();
        if (limit < 0) {
            throw JmapException.invalidArguments("limit must not be negative");
        }
        limit = Math.min(limit, maxLimit);

        Comparator<Mailbox> order = comparator(args.getSort());
        List<Mailbox> all = new ArrayList<>(mailboxMapper.findByAccount(accountId));
        all.sort(order);

        List<Mailbox> ordered = args.isSortAsTree() || args.isFilterAsTree() ? depthFirst(all) : all;
        Set<String> included = new HashSet<>();
        List<String> matched = new ArrayList<>();
        for (Mailbox mailbox : ordered) {
            boolean matches = matches(mailbox, args.getFilter());
            if (args.isFilterAsTree() && mailbox.getParentId() != null && !included.contains(mailbox.getParentId())
                    && containsId(all, mailbox.getParentId())) {
                matches = false;
            }
            if (matches) {
                included.add(mailbox.getId());
            }
        }
        List<Mailbox> resultOrder = args.isSortAsTree() ? ordered : all;
        for (Mailbox mailbox : resultOrder) {
            if (included.contains(mailbox.getId())) {
                matched.add(mailbox.getId());
            }
        }

        int from = Math.min(args.getPosition(), matched.size());
        int to = Math.min(from + limit, matched.size());

        QueryResponse response = new QueryResponse();
        response.setAccountId(accountId);
        response.setQueryState(changeLogService.getState(accountId, JmapType.MAILBOX));
        response.setCanCalculateChanges(false);
        response.setPosition(from);
        response.setIds(new ArrayList<>(matched.subList(from, to)));
        response.setTotal(args.isCalculateTotal() ? matched.size() : null);
        response.setLimit(args.getLimit() != null && args.getLimit() > maxLimit ? maxLimit : null);
        return response;
    }

    static boolean matches(Mailbox mailbox, MailboxQueryArgs.Filter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.isParentIdPresent() && !Objects.equals(mailbox.getParentId(), filter.getParentId())) {
            return false;
        }
        if (filter.getName() != null && (mailbox.getName() == null
                || !mailbox.getName().toLowerCase(Locale.ROOT).contains(filter.getName().toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (filter.getRole() != null && !filter.getRole().equalsIgnoreCase(mailbox.getRole())) {
            return false;
        }
        if (filter.getHasAnyRole() != null && filter.getHasAnyRole() != (mailbox.getRole() != null)) {
            return false;
        }
        return filter.getIsSubscribed() == null || filter.getIsSubscribed() == mailbox.isSubscribed();
    }

    private static Comparator<Mailbox> comparator(List<MailboxQueryArgs.Comparator> sort) {
        Comparator<Mailbox> byName = Comparator.comparing(m -> m.getName() == null ? "" : m.getName(),
                String.CASE_INSENSITIVE_ORDER);
        Comparator<Mailbox> byId = Comparator.comparing(Mailbox::getId);
        if (sort == null || sort.isEmpty()) {
            return Comparator.comparingInt(Mailbox::getSortOrder).thenComparing(byName).thenComparing(byId);
        }
        Comparator<Mailbox> result = null;
        for (MailboxQueryArgs.Comparator item : sort) {
            Comparator<Mailbox> next;
            if ("sortOrder".equals(item.getProperty())) {
                next = Comparator.comparingInt(Mailbox::getSortOrder);
            } else if ("name".equals(item.getProperty())) {
                next = byName;
            } else {
                throw JmapException.invalidArguments("Unsupported sort property: " + item.getProperty());
            }
            if (Boolean.FALSE.equals(item.getIsAscending())) {
                next = next.reversed();
            }
            result = result == null ? next : result.thenComparing(next);
        }
        return result.thenComparing(byId);
    }

    /**
     * Parents before children; a mailbox whose parent is missing is treated as top-level
     */
    private static List<Mailbox> depthFirst(List<Mailbox> sorted) {
        Map<String, List<Mailbox>> children = new HashMap<>();
        List<Mailbox> roots = new ArrayList<>();
        for (Mailbox mailbox : sorted) {
            if (mailbox.getParentId() == null || !containsId(sorted, mailbox.getParentId())) {
                roots.add(mailbox);
            } else {
                children.computeIfAbsent(mailbox.getParentId(), k -> new ArrayList<>()).add(mailbox);
            }
        }
        List<Mailbox> result = new ArrayList<>();
        for (Mailbox root : roots) {
            appendSubtree(root, children, result);
        }
        return result;
    }

    private static void appendSubtree(Mailbox mailbox, Map<String, List<Mailbox>> children, List<Mailbox> result) {
        result.add(mailbox);
        for (Mailbox child : children.getOrDefault(mailbox.getId(), List.of())) {
            appendSubtree(child, children, result);
        }
    }

    private static boolean containsId(List<Mailbox> mailboxes, String id) {
        for (Mailbox mailbox : mailboxes) {
            if (mailbox.getId().equals(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Mailbox/set: creates, then updates, then destroys, in one transaction
     */
    @Transactional(noRollbackFor = JmapException.class)
    public SetResponse set(String accountId, MailboxSetArgs args, InvocationContext context) {
        if (args.objectCount() > properties.getLimits().getMaxObjectsInSet()) {
            throw new JmapException(JmapErrorType.LIMIT_EXCEEDED,
                    "Too many objects, maximum is " + properties.getLimits().getMaxObjectsInSet());
        }
        changeLogService.assertInState(accountId, JmapType.MAILBOX, args.getIfInState());
        SetResponse response = new SetResponse(accountId, changeLogService.getState(accountId, JmapType.MAILBOX));

        if (args.getCreate() != null) {
            createAll(accountId, args.getCreate(), context, response);
        }
        if (args.getUpdate() != null) {
            for (Map.Entry<String, Map<String, Object>> entry : args.getUpdate().entrySet()) {
                try {
                    update(accountId, entry.getKey(), entry.getValue(), context);
                    response.addUpdated(entry.getKey(), null);
                } catch (JmapException e) {
                    response.addNotUpdated(entry.getKey(), e.toSetError());
                }
            }
        }
        if (args.getDestroy() != null) {
            for (String id : args.getDestroy()) {
                try {
                    destroy(accountId, context.resolveId(id), args.isOnDestroyRemoveEmails());
                    response.addDestroyed(id);
                } catch (JmapException e) {
                    response.addNotDestroyed(id, e.toSetError());
                }
            }
        }

        response.setNewState(changeLogService.getState(accountId, JmapType.MAILBOX));
        return response;
    }

    /**
     * Creations whose parent is another creation of the same batch wait until that parent exists
     */
    private void createAll(String accountId, Map<String, MailboxCreate> creates, InvocationContext context,
                           SetResponse response) {
        Map<String, MailboxCreate> pending = new LinkedHashMap<>(creates);
        boolean progress = true;
        while (!pending.isEmpty() && progress) {
            progress = false;
            for (Map.Entry<String, MailboxCreate> entry : new ArrayList<>(pending.entrySet())) {
                String parentRef = entry.getValue().getParentId();
                if (context.isCreationReference(parentRef)
                        && context.resolveId(parentRef) == null
                        && pending.containsKey(parentRef.substring(1))) {
                    continue;
                }
                pending.remove(entry.getKey());
                progress = true;
                try {
                    Mailbox mailbox = create(accountId, entry.getValue(), context);
                    context.putCreatedId(entry.getKey(), mailbox.getId());
                    response.addCreated(entry.getKey(), createdView(mailbox));
                } catch (JmapException e) {
                    response.addNotCreated(entry.getKey(), e.toSetError());
                }
            }
        }
        // Whatever is left waits on a parent that failed or references itself
        for (String creationId : pending.keySet()) {
            response.addNotCreated(creationId, new SetError(JmapErrorType.INVALID_PROPERTIES,
                    "Parent mailbox could not be created", List.of("parentId")));
        }
    }

    Mailbox create(String accountId, MailboxCreate create, InvocationContext context) {
        String name = validateName(create.getName());
        String role = normalizeRole(create.getRole());
        if (role != null && mailboxMapper.findByRole(accountId, role) != null) {
            throw new JmapException(JmapErrorType.ROLE_CONFLICT, "Role " + role + " is already assigned");
        }
        String parentId = resolveParent(accountId, null, create.getParentId(), context);

        Mailbox mailbox = newMailbox(accountId, name, parentId, role,
                create.getSortOrder() == null ? 0 : create.getSortOrder(),
                create.getIsSubscribed() == null || create.getIsSubscribed());
        mailboxMapper.insert(mailbox);
        changeLogService.record(accountId, JmapType.MAILBOX, mailbox.getId(), ChangeOp.CREATE);
        log.info("Mailbox created: account={}, id={}, name={}", accountId, mailbox.getId(), name);
        return mailbox;
    }

    void update(String accountId, String idRef, Map<String, Object> patch, InvocationContext context) {
        String id = context.resolveId(idRef);
        Mailbox current = id == null ? null : mailboxMapper.findById(accountId, id);
        if (current == null) {
            throw JmapException.notFound("Mailbox not found: " + idRef);
        }
        for (String property : patch.keySet()) {
            if (!UPDATABLE.contains(property)) {
                throw JmapException.invalidProperties("Property cannot be updated: " + property, property);
            }
        }

        Mailbox.MailboxBuilder next = current.toBuilder();
        if (patch.containsKey("name")) {
            next.name(validateName(asString(patch.get("name"), "name")));
        }
        if (patch.containsKey("role")) {
            String role = normalizeRole(asString(patch.get("role"), "role"));
            if (role != null) {
                Mailbox owner = mailboxMapper.findByRole(accountId, role);
                if (owner != null && !owner.getId().equals(id)) {
                    throw new JmapException(JmapErrorType.ROLE_CONFLICT, "Role " + role + " is already assigned");
                }
            }
            next.role(role);
        }
        if (patch.containsKey("parentId")) {
            next.parentId(resolveParent(accountId, id, asString(patch.get("parentId"), "parentId"), context));
        }
        if (patch.containsKey("sortOrder")) {
            Object value = patch.get("sortOrder");
            if (!(value instanceof Number number) || number.intValue() < 0) {
                throw JmapException.invalidProperties("sortOrder must be a non-negative integer", "sortOrder");
            }
            next.sortOrder(number.intValue());
        }
        if (patch.containsKey("isSubscribed")) {
            if (!(patch.get("isSubscribed") instanceof Boolean subscribed)) {
                throw JmapException.invalidProperties("isSubscribed must be a boolean", "isSubscribed");
            }
            next.subscribed(subscribed);
        }

        Mailbox updated = next.updatedAt(clock.instant()).build();
        mailboxMapper.update(updated);
        changeLogService.record(accountId, JmapType.MAILBOX, id, ChangeOp.UPDATE, patch.keySet());
        log.debug("Mailbox updated: account={}, id={}, properties={}", accountId, id, patch.keySet());
    }

    void destroy(String accountId, String id, boolean removeEmails) {
        Mailbox mailbox = id == null ? null : mailboxMapper.findById(accountId, id);
        if (mailbox == null) {
            throw JmapException.notFound("Mailbox not found: " + id);
        }
        if (mailboxMapper.countChildren(id) > 0) {
            throw new JmapException(JmapErrorType.MAILBOX_HAS_CHILD, "Mailbox has child mailboxes");
        }
        if (mailboxMapper.countMessages(id) > 0) {
            if (!removeEmails) {
                throw new JmapException(JmapErrorType.MAILBOX_HAS_EMAIL, "Mailbox still contains emails");
            }
            detachEmails(accountId, id);
        }

        mailboxMapper.deleteById(id);
        changeLogService.record(accountId, JmapType.MAILBOX, id, ChangeOp.DESTROY);
        log.info("Mailbox destroyed: account={}, id={}, name={}", accountId, id, mailbox.getName());
    }

    /**
     * Drop every membership of the mailbox; emails left without any mailbox are destroyed
     */
    private void detachEmails(String accountId, String mailboxId) {
        Instant now = clock.instant();
        for (String emailId : accountMessageMapper.findIdsByMailbox(mailboxId)) {
            accountMessageMapper.deleteMembership(emailId, mailboxId);
            if (accountMessageMapper.findMailboxIds(emailId).isEmpty()) {
                AccountMessage message = accountMessageMapper.findAnyById(emailId);
                if (message != null && !message.isDeleted()) {
                    cleanupService.softDelete(message);
                }
                continue;
            }
            accountMessageMapper.touch(emailId, now);
            changeLogService.record(accountId, JmapType.EMAIL, emailId, ChangeOp.UPDATE, List.of("mailboxIds"));
        }
    }

    private String resolveParent(String accountId, String mailboxId, String parentRef, InvocationContext context) {
        if (parentRef == null) {
            return null;
        }
        String parentId = context.resolveId(parentRef);
        if (parentId == null) {
            throw JmapException.invalidProperties("Unknown creation id: " + parentRef, "parentId");
        }
        if (parentId.equals(mailboxId)) {
            throw JmapException.invalidProperties("Mailbox cannot be its own parent", "parentId");
        }
        if (mailboxMapper.findById(accountId, parentId) == null) {
            throw JmapException.invalidProperties("Parent mailbox not found: " + parentRef, "parentId");
        }
        if (mailboxId != null) {
            Set<String> visited = new HashSet<>();
            String cursor = parentId;
            while (cursor != null && visited.add(cursor)) {
                if (cursor.equals(mailboxId)) {
                    throw JmapException.invalidProperties("Parent would create a cycle", "parentId");
                }
                Mailbox ancestor = mailboxMapper.findById(accountId, cursor);
                cursor = ancestor == null ? null : ancestor.getParentId();
            }
        }
        return parentId;
    }

    private String validateName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw JmapException.invalidProperties("Mailbox name must not be empty", "name");
        }
        if (trimmed.length() > properties.getLimits().getMaxSizeMailboxName()) {
            throw JmapException.invalidProperties("Mailbox name is too long", "name");
        }
        return trimmed;
    }

    private String normalizeRole(String role) {
        if (role == null) {
            return null;
        }
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        if (!DEFAULT_ROLES.containsKey(normalized)) {
            throw JmapException.invalidProperties("Unsupported role: " + role, "role");
        }
        return normalized;
    }

    private String asString(Object value, String property) {
        if (value != null && !(value instanceof String)) {
            throw JmapException.invalidProperties(property + " must be a string or null", property);
        }
        return (String) value;
    }

    private Mailbox newMailbox(String accountId, String name, String parentId, String role, int sortOrder,
                               boolean subscribed) {
        Instant now = clock.instant();
        return Mailbox.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .name(name)
                .parentId(parentId)
                .role(role)
                .sortOrder(sortOrder)
                .subscribed(subscribed)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private Map<String, Object> createdView(Mailbox mailbox) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", mailbox.getId());
        view.put("parentId", mailbox.getParentId());
        for (String property : COUNT_PROPERTIES) {
            view.put(property, 0);
        }
        view.put("myRights", myRights());
        return view;
    }

    Map<String, Object> toJmap(Mailbox mailbox, MailboxCounts counts) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", mailbox.getId());
        view.put("name", mailbox.getName());
        view.put("parentId", mailbox.getParentId());
        view.put("role", mailbox.getRole());
        view.put("sortOrder", mailbox.getSortOrder());
        view.put("totalEmails", counts == null ? 0 : counts.getTotalEmails());
        view.put("unreadEmails", counts == null ? 0 : counts.getUnreadEmails());
        view.put("totalThreads", counts == null ? 0 : counts.getTotalThreads());
        view.put("unreadThreads", counts == null ? 0 : counts.getUnreadThreads());
        view.put("myRights", myRights());
        view.put("isSubscribed", mailbox.isSubscribed());
        return view;
    }

    private Map<String, Boolean> myRights() {
        Map<String, Boolean> rights = new LinkedHashMap<>();
        for (String right : List.of("mayReadItems", "mayAddItems", "mayRemoveItems", "maySetSeen",
                "maySetKeywords", "mayCreateChild", "mayRename", "mayDelete", "maySubmit")) {
            rights.put(right, true);
        }
        return rights;
    }

    /**
     * Keep only the requested properties; id is always returned
     */
    static Map<String, Object> filter(Map<String, Object> view, List<String> properties) {
        if (properties == null) {
            return view;
        }
        Map<String, Object> filtered = new LinkedHashMap<>();
        filtered.put("id", view.get("id"));
        for (String property : properties) {
            if (view.containsKey(property)) {
                filtered.put(property, view.get(property));
            }
        }
        return filtered;
    }
}
