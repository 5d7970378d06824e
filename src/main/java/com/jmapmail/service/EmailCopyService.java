package com.jmapmail.service;

import com.jmapmail.domain.AccountMessage;
import com.jmapmail.domain.CanonicalMessage;
import com.jmapmail.domain.JmapType;
import com.jmapmail.jmap.InvocationContext;
import com.jmapmail.jmap.JmapException;
import com.jmapmail.jmap.SetResponse;
import com.jmapmail.jmap.args.EmailCopyArgs;
import com.jmapmail.jmap.args.EmailSetArgs;
import com.jmapmail.mapper.AccountMessageMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Email/copy within one account.
 * The copy shares the canonical message and thread of its source;
 * onSuccessDestroyOriginal is issued as an implicit Email/set destroy.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailCopyService {

    private final AccountMessageMapper accountMessageMapper;
    private final IngestionService ingestionService;
    private final EmailSetService emailSetService;
    private final ChangeLogService changeLogService;

    @Transactional(noRollbackFor = JmapException.class)
    public SetResponse copy(String accountId, EmailCopyArgs args, InvocationContext context) {
        String fromAccountId = args.getFromAccountId() == null ? accountId : args.getFromAccountId();
        if (!fromAccountId.equals(accountId)) {
            throw JmapException.invalidArguments("Copying between accounts is not supported");
        }
        changeLogService.assertInState(accountId, JmapType.EMAIL, args.getIfFromInState());
        changeLogService.assertInState(accountId, JmapType.EMAIL, args.getIfInState());

        SetResponse response = new SetResponse(accountId, changeLogService.getState(accountId, JmapType.EMAIL));
        response.setFromAccountId(fromAccountId);

        List<String> copiedSources = new ArrayList<>();
        if (args.getCreate() != null) {
            for (Map.Entry<String, EmailCopyArgs.CopyEntry> entry : args.getCreate().entrySet()) {
                try {
                    String sourceId = context.resolveId(entry.getValue().getId());
                    AccountMessage copy = copyOne(accountId, sourceId, entry.getValue(), context);
                    context.putCreatedId(entry.getKey(), copy.getId());
                    response.addCreated(entry.getKey(), createdView(copy));
                    copiedSources.add(sourceId);
                } catch (JmapException e) {
                    response.addNotCreated(entry.getKey(), e.toSetError());
                }
            }
        }
        response.setNewState(changeLogService.getState(accountId, JmapType.EMAIL));

        if (args.isOnSuccessDestroyOriginal() && !copiedSources.isEmpty()) {
            EmailSetArgs destroy = new EmailSetArgs();
            destroy.setAccountId(accountId);
            destroy.setIfInState(args.getDestroyFromIfInState());
            destroy.setDestroy(copiedSources);
            try {
                context.addImplicitResponse("Email/set", emailSetService.set(accountId, destroy, context));
            } catch (JmapException e) {
                context.addImplicitResponse("error", Map.of("type", e.getType(), "description", e.getMessage()));
            }
        }
        return response;
    }

    AccountMessage copyOne(String accountId, String sourceId, EmailCopyArgs.CopyEntry entry,
                           InvocationContext context) {
        AccountMessage source = sourceId == null ? null : accountMessageMapper.findById(accountId, sourceId);
        if (source == null) {
            throw JmapException.notFound("Email not found: " + entry.getId());
        }
        List<String> mailboxIds = emailSetService.resolveMailboxes(accountId, entry.getMailboxIds(), context);

        KeywordSupport.Split keywords = entry.getKeywords() != null
                ? KeywordSupport.split(entry.getKeywords())
                : KeywordSupport.split(sourceKeywords(source));

        CanonicalMessage canonical = ingestionService.findCanonical(source.getMessageId());
        AccountMessage copy = ingestionService.ingestForAccount(accountId, canonical, mailboxIds, keywords,
                entry.getReceivedAt() != null ? entry.getReceivedAt() : source.getInternalDate(),
                source.getThreadId());
        log.info("Email copied: account={}, source={}, copy={}", accountId, sourceId, copy.getId());
        return copy;
    }

    private Map<String, Boolean> sourceKeywords(AccountMessage source) {
        return KeywordSupport.toJmap(source.isSeen(), source.isFlagged(), source.isAnswered(), source.isDraft(),
                accountMessageMapper.findKeywords(source.getId()));
    }

    private Map<String, Object> createdView(AccountMessage message) {
        CanonicalMessage canonical = ingestionService.findCanonical(message.getMessageId());
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", message.getId());
        view.put("blobId", canonical.getRawBlobSha256());
        view.put("threadId", message.getThreadId());
        view.put("size", canonical.getSize());
        return view;
    }
}
