package com.ai.intake.controller;

import com.ai.intake.component.ResponsePhrases;
import com.ai.intake.conversation.InvalidTransitionException;
import com.ai.intake.service.ConversationService;
import com.ai.intake.service.TurnResult;
import com.ai.intake.session.SessionCorruptedException;
import com.ai.intake.utils.PhoneMask;
import com.twilio.http.HttpMethod;
import com.twilio.twiml.TwiMLException;
import com.twilio.twiml.VoiceResponse;
import com.twilio.twiml.voice.Gather;
import com.twilio.twiml.voice.Hangup;
import com.twilio.twiml.voice.Redirect;
import com.twilio.twiml.voice.Say;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

/**
 * Twilio webhooks. Each speech result runs one turn and the next prompt goes back as TwiML.
 */
@RestController
public class TwilioVoiceController {

    private static final Logger log = LoggerFactory.getLogger(TwilioVoiceController.class);

    private static final String COLLECT_PATH = "/twilio/voice/collect";

    private final ConversationService conversationService;
    private final ResponsePhrases phrases;

    @Value("${twilio.base-url:}")
    private String baseUrl;

    public TwilioVoiceController(ConversationService conversationService, ResponsePhrases phrases) {
        this.conversationService = conversationService;
        this.phrases = phrases;
    }

    @PostMapping(value = "/twilio/voice", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> inbound(
            @RequestParam(value = "CallSid", required = false) String callSid,
            @RequestParam(value = "From", required = false) String from) {
        log.info("Inbound call callSid={} from={}", callSid, PhoneMask.mask(from));
        return ResponseEntity.ok(gather(conversationService.openingPrompt()));
    }

    @PostMapping(value = COLLECT_PATH, produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> collect(
            @RequestParam("CallSid") String callSid,
            @RequestParam(value = "From", required = false) String from,
            @RequestParam(value = "SpeechResult", required = false) String speechResult) {
        MDC.put("callId", callSid);
        try {
            TurnResult result = conversationService.handleTurn(callSid, from, speechResult);
            return ResponseEntity.ok(result.terminal() ? sayAndHangUp(result.nextPrompt()) : gather(result.nextPrompt()));
        } catch (SessionCorruptedException | InvalidTransitionException e) {
            log.error("Fatal turn error for callSid={}: {}", callSid, e.getMessage(), e);
            return ResponseEntity.ok(sayAndHangUp(phrases.apology()));
        } finally {
            MDC.remove("callId");
        }
    }

    private String gather(String prompt) {
        Gather gather = new Gather.Builder()
                .inputs(Gather.Input.SPEECH)
                .action(collectUrl())
                .method(HttpMethod.POST)
                .speechTimeout("auto")
                .language(Gather.Language.EN_CA)
                .say(say(prompt))
                .build();
        // no speech: Twilio falls through to the redirect and the empty turn is re-prompted
        Redirect redirect = new Redirect.Builder(collectUrl()).method(HttpMethod.POST).build();
        return render(new VoiceResponse.Builder().gather(gather).redirect(redirect).build(), prompt);
    }

    private String sayAndHangUp(String prompt) {
        VoiceResponse response = new VoiceResponse.Builder()
                .say(say(prompt))
                .hangup(new Hangup.Builder().build())
                .build();
        return render(response, prompt);
    }

    private static Say say(String text) {
        return new Say.Builder(text).voice(Say.Voice.ALICE).language(Say.Language.EN_CA).build();
    }

    private String render(VoiceResponse response, String prompt) {
        try {
            return response.toXml();
        } catch (TwiMLException e) {
            log.error("Failed to render TwiML for prompt '{}'", prompt, e);
            return fallbackTwiml(prompt);
        }
    }

    private String collectUrl() {
        return StringUtils.hasText(baseUrl) ? baseUrl.trim().replaceAll("/$", "") + COLLECT_PATH : COLLECT_PATH;
    }

    static String fallbackTwiml(String prompt) {
        return "<Response><Say>" + HtmlUtils.htmlEscape(prompt == null ? "" : prompt) + "</Say></Response>";
    }
}
