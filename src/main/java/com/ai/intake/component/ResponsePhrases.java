package com.ai.intake.component;

import org.springframework.stereotype.Component;

/**
 * Caller-facing phrases. Short and friendly; every question tells the caller what kind of answer works.
 */
@Component
public class ResponsePhrases {

    public String greeting() {
        return "Hi there! Thanks for calling. I'll help you book your appointment today. What's your name?";
    }

    public String askName() {
        return "What's your full name, please?";
    }

    public String askPhone(String name) {
        String first = name == null ? "" : name.split(" ")[0];
        return first.isEmpty()
                ? "Perfect! What's your phone number?"
                : "Thanks, " + first + "! What's your phone number?";
    }

    public String askTime() {
        return "Great! When would you like your appointment? You can say something like 'next Tuesday at 2' or 'Friday morning'.";
    }

    public String askTimeAgain() {
        return "Okay, no problem. What date and time would you like instead?";
    }

    public String confirmBooking(String name, String phone, String when) {
        return "I have " + name + ", " + phone + ", " + when + ". Should I book it? Please say yes or no.";
    }

    public String confirmUnclear(String name, String phone, String when) {
        return "Sorry, was that a yes or a no? I have " + name + ", " + phone + ", " + when + ".";
    }

    public String bookingConfirmed(String when) {
        return "Thank you. Your appointment is booked for " + when + ". We look forward to seeing you.";
    }

    public String alreadyBooked(String when) {
        return "You're all set. Your appointment is booked for " + when + ". Have a good day!";
    }

    public String clarifyName(int attempt) {
        return attempt <= 1
                ? "Sorry, I didn't quite get your name. Could you say your first and last name?"
                : "Let's try once more. Please say just your first and last name, like 'Jane Smith'.";
    }

    public String clarifyPhone(int attempt) {
        return attempt <= 1
                ? "Sorry, I didn't catch that. Can you say your phone number again?"
                : "Please say the ten digits of your phone number slowly, including the area code.";
    }

    public String clarifyTime(int attempt) {
        return attempt <= 1
                ? "I didn't catch that. Could you please say a specific date and time, like next Tuesday at 2 PM?"
                : "Please say a day and a time, for example 'Thursday at 10 AM' or 'October 22nd at 3 PM'.";
    }

    public String timeInPast() {
        return "That time has already passed. What date and time would you like?";
    }

    public String outsideHours(String nextOpening) {
        return "That time is outside our business hours. How about " + nextOpening + "? Or please say another time.";
    }

    public String outsideHoursNoOpening() {
        return "That time is outside our business hours, and I don't see an opening soon. Please say another time.";
    }

    public String bookingFailed() {
        return "I'm sorry, I couldn't save that booking just now. Should I try again? Please say yes or no.";
    }

    public String didntCatch() {
        return "Sorry, I didn't catch that.";
    }

    public String goodbye() {
        return "Thanks for calling. Have a good day!";
    }

    public String apology() {
        return "I'm really sorry, something went wrong on our end. Please call back in a few minutes.";
    }
}
